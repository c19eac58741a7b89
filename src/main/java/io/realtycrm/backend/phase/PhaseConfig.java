package io.realtycrm.backend.phase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** Phase-system settings of a tenant. At most one row per tenant. */
@Entity
@Table(name = "phase_configs")
public class PhaseConfig {

  public static final BigDecimal DEFAULT_COMMISSION_PCT = new BigDecimal("50.00");
  private static final int[] DEFAULT_WEIGHTS = {100, 150, 200, 250, 300};
  public static final int DEFAULT_ATTEMPTS_PHASE_1 = 3;
  public static final int DEFAULT_MAX_SOLITARY_MONTHS = 3;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, unique = true, updatable = false)
  private UUID tenantId;

  @Column(name = "active", nullable = false)
  private boolean active = true;

  @Column(name = "pool_property_id")
  private UUID poolPropertyId;

  @Column(name = "advisor_commission_pct", nullable = false, precision = 5, scale = 2)
  private BigDecimal advisorCommissionPct = DEFAULT_COMMISSION_PCT;

  @Column(name = "company_commission_pct", nullable = false, precision = 5, scale = 2)
  private BigDecimal companyCommissionPct = DEFAULT_COMMISSION_PCT;

  @Column(name = "phase1_weight", nullable = false)
  private int phase1Weight = DEFAULT_WEIGHTS[0];

  @Column(name = "phase2_weight", nullable = false)
  private int phase2Weight = DEFAULT_WEIGHTS[1];

  @Column(name = "phase3_weight", nullable = false)
  private int phase3Weight = DEFAULT_WEIGHTS[2];

  @Column(name = "phase4_weight", nullable = false)
  private int phase4Weight = DEFAULT_WEIGHTS[3];

  @Column(name = "phase5_weight", nullable = false)
  private int phase5Weight = DEFAULT_WEIGHTS[4];

  @Column(name = "attempts_phase1", nullable = false)
  private int attemptsPhase1 = DEFAULT_ATTEMPTS_PHASE_1;

  @Column(name = "max_solitary_months", nullable = false)
  private int maxSolitaryMonths = DEFAULT_MAX_SOLITARY_MONTHS;

  @Version private Long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected PhaseConfig() {}

  /** Creates a config with the default weights, 50/50 split and thresholds. */
  public PhaseConfig(UUID tenantId, Instant now) {
    this.tenantId = tenantId;
    this.createdAt = now;
    this.updatedAt = now;
  }

  /** Applies the non-null fields of {@code changes}; everything else keeps its current value. */
  public void merge(PhaseConfigChanges changes, Instant now) {
    if (changes.poolPropertyId() != null) this.poolPropertyId = changes.poolPropertyId();
    if (changes.advisorCommissionPct() != null) {
      this.advisorCommissionPct = changes.advisorCommissionPct();
    }
    if (changes.companyCommissionPct() != null) {
      this.companyCommissionPct = changes.companyCommissionPct();
    }
    if (changes.phase1Weight() != null) this.phase1Weight = changes.phase1Weight();
    if (changes.phase2Weight() != null) this.phase2Weight = changes.phase2Weight();
    if (changes.phase3Weight() != null) this.phase3Weight = changes.phase3Weight();
    if (changes.phase4Weight() != null) this.phase4Weight = changes.phase4Weight();
    if (changes.phase5Weight() != null) this.phase5Weight = changes.phase5Weight();
    if (changes.attemptsPhase1() != null) this.attemptsPhase1 = changes.attemptsPhase1();
    if (changes.maxSolitaryMonths() != null) this.maxSolitaryMonths = changes.maxSolitaryMonths();
    this.updatedAt = now;
  }

  public void setActive(boolean active, Instant now) {
    this.active = active;
    this.updatedAt = now;
  }

  /** Lead weight of an advisor in {@code phase}; 0 outside phases 1-5 (solitary mode). */
  public int weightFor(int phase) {
    return switch (phase) {
      case 1 -> phase1Weight;
      case 2 -> phase2Weight;
      case 3 -> phase3Weight;
      case 4 -> phase4Weight;
      case 5 -> phase5Weight;
      default -> 0;
    };
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public boolean isActive() {
    return active;
  }

  public UUID getPoolPropertyId() {
    return poolPropertyId;
  }

  public BigDecimal getAdvisorCommissionPct() {
    return advisorCommissionPct;
  }

  public BigDecimal getCompanyCommissionPct() {
    return companyCommissionPct;
  }

  public int getPhase1Weight() {
    return phase1Weight;
  }

  public int getPhase2Weight() {
    return phase2Weight;
  }

  public int getPhase3Weight() {
    return phase3Weight;
  }

  public int getPhase4Weight() {
    return phase4Weight;
  }

  public int getPhase5Weight() {
    return phase5Weight;
  }

  public int getAttemptsPhase1() {
    return attemptsPhase1;
  }

  public int getMaxSolitaryMonths() {
    return maxSolitaryMonths;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
