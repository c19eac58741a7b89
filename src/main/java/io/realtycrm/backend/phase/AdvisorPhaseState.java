package io.realtycrm.backend.phase;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.time.Instant;
import java.time.YearMonth;

/**
 * Per-tenant phase-system state of an advisor, stored on the tenant membership row. Only the phase
 * package mutates it: enrollment and removal in {@link AdvisorPhaseService}, transitions in {@link
 * PhaseProgression}.
 *
 * <p>Invariants: {@code currentPhase} is in [0, 5]; {@code solitary} holds exactly when {@code
 * currentPhase == 0}; {@code prestige} never decreases.
 */
@Embeddable
public class AdvisorPhaseState {

  public static final int SOLITARY_PHASE = 0;
  public static final int FIRST_PHASE = 1;
  public static final int TOP_PHASE = 5;

  @Column(name = "phase_enrolled", nullable = false)
  private boolean enrolled;

  @Column(name = "current_phase", nullable = false)
  private int currentPhase = FIRST_PHASE;

  @Column(name = "solitary", nullable = false)
  private boolean solitary;

  @Column(name = "phase1_attempts_used", nullable = false)
  private int phase1AttemptsUsed;

  @Column(name = "solitary_months_without_sale", nullable = false)
  private int solitaryMonthsWithoutSale;

  @Column(name = "prestige", nullable = false)
  private int prestige;

  @Column(name = "phase5_sale_counter", nullable = false)
  private int phase5SaleCounter;

  @Column(name = "ultra_record", nullable = false)
  private int ultraRecord;

  @Column(name = "ultra_month", length = 7)
  private String ultraMonth;

  @Column(name = "sales_this_month", nullable = false)
  private int salesThisMonth;

  @Column(name = "tracking_month", length = 7)
  private String trackingMonth;

  @Column(name = "phase_enrolled_at")
  private Instant enrolledAt;

  public AdvisorPhaseState() {}

  // --- Lifecycle ---

  /**
   * Puts the advisor at the start of the ladder. Prestige, the phase-5 counter and the ULTRA record
   * are permanent and survive re-enrollment.
   */
  public void enroll(YearMonth month, Instant now) {
    this.enrolled = true;
    this.currentPhase = FIRST_PHASE;
    this.solitary = false;
    this.phase1AttemptsUsed = 0;
    this.solitaryMonthsWithoutSale = 0;
    this.salesThisMonth = 0;
    this.trackingMonth = month.toString();
    this.enrolledAt = now;
  }

  void exit() {
    this.enrolled = false;
  }

  // --- Transitions used by PhaseProgression ---

  void moveToPhase(int phase) {
    if (phase < FIRST_PHASE || phase > TOP_PHASE) {
      throw new IllegalArgumentException("Phase must be between 1 and 5: " + phase);
    }
    if (this.currentPhase == FIRST_PHASE && phase != FIRST_PHASE) {
      this.phase1AttemptsUsed = 0;
    }
    this.currentPhase = phase;
  }

  void enterSolitary() {
    this.currentPhase = SOLITARY_PHASE;
    this.solitary = true;
    this.solitaryMonthsWithoutSale = 0;
    this.phase1AttemptsUsed = 0;
  }

  void exitSolitary() {
    this.currentPhase = FIRST_PHASE;
    this.solitary = false;
    this.phase1AttemptsUsed = 0;
  }

  void setPhase1AttemptsUsed(int phase1AttemptsUsed) {
    this.phase1AttemptsUsed = phase1AttemptsUsed;
  }

  void setSolitaryMonthsWithoutSale(int solitaryMonthsWithoutSale) {
    this.solitaryMonthsWithoutSale = solitaryMonthsWithoutSale;
  }

  void startTrackingMonth(YearMonth month) {
    this.trackingMonth = month.toString();
    this.salesThisMonth = 0;
  }

  void countSale() {
    this.salesThisMonth++;
  }

  void addPrestige(int gained) {
    if (gained < 0) {
      throw new IllegalArgumentException("Prestige never decreases");
    }
    this.prestige += gained;
  }

  void setPhase5SaleCounter(int phase5SaleCounter) {
    this.phase5SaleCounter = phase5SaleCounter;
  }

  void recordUltra(int ultraRecord, YearMonth month) {
    this.ultraRecord = ultraRecord;
    this.ultraMonth = month.toString();
  }

  // --- Getters ---

  public boolean isEnrolled() {
    return enrolled;
  }

  public int getCurrentPhase() {
    return currentPhase;
  }

  public boolean isSolitary() {
    return solitary;
  }

  public int getPhase1AttemptsUsed() {
    return phase1AttemptsUsed;
  }

  public int getSolitaryMonthsWithoutSale() {
    return solitaryMonthsWithoutSale;
  }

  public int getPrestige() {
    return prestige;
  }

  public int getPhase5SaleCounter() {
    return phase5SaleCounter;
  }

  public int getUltraRecord() {
    return ultraRecord;
  }

  public String getUltraMonth() {
    return ultraMonth;
  }

  public int getSalesThisMonth() {
    return salesThisMonth;
  }

  public String getTrackingMonth() {
    return trackingMonth;
  }

  public Instant getEnrolledAt() {
    return enrolledAt;
  }
}
