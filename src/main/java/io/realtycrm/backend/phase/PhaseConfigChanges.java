package io.realtycrm.backend.phase;

import java.math.BigDecimal;
import java.util.UUID;

/** Partial update of a {@link PhaseConfig}; null components are left untouched. */
public record PhaseConfigChanges(
    UUID poolPropertyId,
    BigDecimal advisorCommissionPct,
    BigDecimal companyCommissionPct,
    Integer phase1Weight,
    Integer phase2Weight,
    Integer phase3Weight,
    Integer phase4Weight,
    Integer phase5Weight,
    Integer attemptsPhase1,
    Integer maxSolitaryMonths) {

  public static PhaseConfigChanges none() {
    return new PhaseConfigChanges(null, null, null, null, null, null, null, null, null, null);
  }
}
