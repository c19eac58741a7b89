package io.realtycrm.backend.member;

import io.realtycrm.backend.phase.AdvisorPhaseState;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * A user's membership in a tenant. Carries the advisor's phase-system state; the row is keyed by
 * (tenant, user).
 */
@Entity
@Table(name = "tenant_users")
public class TenantMembership {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false)
  private UUID tenantId;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "active", nullable = false)
  private boolean active = true;

  @Embedded private AdvisorPhaseState phaseState = new AdvisorPhaseState();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TenantMembership() {}

  public TenantMembership(UUID tenantId, UUID userId) {
    this.tenantId = tenantId;
    this.userId = userId;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void touch(Instant now) {
    this.updatedAt = now;
  }

  public UUID getId() {
    return id;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public UUID getUserId() {
    return userId;
  }

  public boolean isActive() {
    return active;
  }

  public AdvisorPhaseState getPhaseState() {
    if (phaseState == null) {
      // Hibernate leaves an embedded value null when all of its columns are null
      phaseState = new AdvisorPhaseState();
    }
    return phaseState;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
