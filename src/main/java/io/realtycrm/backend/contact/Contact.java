package io.realtycrm.backend.contact;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * CRM contact. Contact CRUD lives elsewhere; this mapping exposes the pool-lead fields the phase
 * system writes.
 */
@Entity
@Table(name = "contacts")
public class Contact {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false)
  private UUID tenantId;

  @Column(name = "first_name", nullable = false, length = 255)
  private String firstName;

  @Column(name = "last_name", length = 255)
  private String lastName;

  @Column(name = "email", length = 255)
  private String email;

  @Column(name = "phone", length = 50)
  private String phone;

  @Column(name = "is_pool_lead", nullable = false)
  private boolean poolLead;

  @Column(name = "lead_source", length = 50)
  private String leadSource;

  @Column(name = "assigned_advisor_id")
  private UUID assignedAdvisorId;

  @Column(name = "lead_assigned_at")
  private Instant leadAssignedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Contact() {}

  public Contact(UUID tenantId, String firstName, String lastName, String email, String phone) {
    this.tenantId = tenantId;
    this.firstName = firstName;
    this.lastName = lastName;
    this.email = email;
    this.phone = phone;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Flags the contact as coming from the shared advertising pool. */
  public void markAsPoolLead(String leadSource, Instant now) {
    this.poolLead = true;
    this.leadSource = leadSource;
    this.updatedAt = now;
  }

  /** Assigns (or reassigns) the pool lead to an advisor. */
  public void assignTo(UUID advisorId, Instant now) {
    if (!poolLead) {
      throw new IllegalStateException("Only pool leads can be assigned: contact " + id);
    }
    this.assignedAdvisorId = advisorId;
    this.leadAssignedAt = now;
    this.updatedAt = now;
  }

  public UUID getId() {
    return id;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public String getFirstName() {
    return firstName;
  }

  public String getLastName() {
    return lastName;
  }

  public String getEmail() {
    return email;
  }

  public String getPhone() {
    return phone;
  }

  public boolean isPoolLead() {
    return poolLead;
  }

  public String getLeadSource() {
    return leadSource;
  }

  public UUID getAssignedAdvisorId() {
    return assignedAdvisorId;
  }

  public Instant getLeadAssignedAt() {
    return leadAssignedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
