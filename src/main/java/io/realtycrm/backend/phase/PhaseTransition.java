package io.realtycrm.backend.phase;

/**
 * One state change produced by {@link PhaseProgression}, to be appended to the phase history.
 *
 * @param previousPhase phase before the change; null on enrollment
 * @param newPhase phase after the change (0 for solitary mode and for exits)
 * @param changeType kind of change
 * @param reason human-readable cause
 * @param causedBySale whether the sale being processed caused it (as opposed to a month rollover)
 * @param prestigeValue prestige after the change, for PRESTIGE/ULTRA entries
 * @param ultraValue ULTRA record after the change, for PRESTIGE/ULTRA entries
 */
public record PhaseTransition(
    Integer previousPhase,
    int newPhase,
    PhaseChangeType changeType,
    String reason,
    boolean causedBySale,
    Integer prestigeValue,
    Integer ultraValue) {

  static PhaseTransition rollover(
      int previousPhase, int newPhase, PhaseChangeType changeType, String reason) {
    return new PhaseTransition(previousPhase, newPhase, changeType, reason, false, null, null);
  }

  static PhaseTransition sale(
      int previousPhase, int newPhase, PhaseChangeType changeType, String reason) {
    return new PhaseTransition(previousPhase, newPhase, changeType, reason, true, null, null);
  }
}
