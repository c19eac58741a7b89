package io.realtycrm.backend.phase;

import java.util.List;
import java.util.UUID;

/**
 * Result of processing a closed sale.
 *
 * @param processed false when the sale was ignored (no config, unknown or non-enrolled advisor)
 * @param poolLead whether the sale came from a pool lead
 * @param transitions changes applied, in order (rollover first)
 * @param state advisor state after processing; null when the sale was ignored
 */
public record SaleOutcome(
    UUID userId,
    UUID saleId,
    boolean processed,
    boolean poolLead,
    List<PhaseTransition> transitions,
    AdvisorPhaseState state) {

  static SaleOutcome ignored(UUID userId, UUID saleId, boolean poolLead) {
    return new SaleOutcome(userId, saleId, false, poolLead, List.of(), null);
  }
}
