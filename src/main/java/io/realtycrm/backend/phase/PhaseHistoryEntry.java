package io.realtycrm.backend.phase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only record of a phase-system change. Rows are never updated or deleted (enforced by a
 * database trigger); the entity has no setters.
 */
@Entity
@Table(name = "phase_history")
public class PhaseHistoryEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false)
  private UUID tenantId;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "previous_phase", updatable = false)
  private Integer previousPhase;

  @Column(name = "new_phase", nullable = false, updatable = false)
  private int newPhase;

  @Enumerated(EnumType.STRING)
  @Column(name = "change_type", nullable = false, length = 30, updatable = false)
  private PhaseChangeType changeType;

  @Column(name = "reason", length = 255, updatable = false)
  private String reason;

  @Column(name = "sale_id", updatable = false)
  private UUID saleId;

  @Column(name = "prestige_value", updatable = false)
  private Integer prestigeValue;

  @Column(name = "ultra_value", updatable = false)
  private Integer ultraValue;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  /** Insertion order, assigned by the database; orders entries written in the same instant. */
  @Column(name = "sequence_number", insertable = false, updatable = false)
  private Long sequenceNumber;

  protected PhaseHistoryEntry() {}

  public PhaseHistoryEntry(
      UUID tenantId, UUID userId, PhaseTransition transition, UUID saleId, Instant createdAt) {
    this.tenantId = tenantId;
    this.userId = userId;
    this.previousPhase = transition.previousPhase();
    this.newPhase = transition.newPhase();
    this.changeType = transition.changeType();
    this.reason = transition.reason();
    this.saleId = saleId;
    this.prestigeValue = transition.prestigeValue();
    this.ultraValue = transition.ultraValue();
    this.createdAt = createdAt;
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

  public Integer getPreviousPhase() {
    return previousPhase;
  }

  public int getNewPhase() {
    return newPhase;
  }

  public PhaseChangeType getChangeType() {
    return changeType;
  }

  public String getReason() {
    return reason;
  }

  public UUID getSaleId() {
    return saleId;
  }

  public Integer getPrestigeValue() {
    return prestigeValue;
  }

  public Integer getUltraValue() {
    return ultraValue;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Long getSequenceNumber() {
    return sequenceNumber;
  }
}
