package io.realtycrm.backend.phase;

import static io.realtycrm.backend.phase.AdvisorPhaseState.FIRST_PHASE;
import static io.realtycrm.backend.phase.AdvisorPhaseState.SOLITARY_PHASE;
import static io.realtycrm.backend.phase.AdvisorPhaseState.TOP_PHASE;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Transition rules of the phase system. Operates on an {@link AdvisorPhaseState} in memory and
 * returns the transitions to append to the history; persistence is the caller's job.
 *
 * <p>Month boundaries are evaluated lazily: a rollover is only applied when a sale event arrives
 * for the advisor, and only one month of decay is applied no matter how many months passed since
 * the tracked one.
 */
public final class PhaseProgression {

  static final int SALES_PER_PRESTIGE = 3;

  private PhaseProgression() {}

  /**
   * Full handling of a closed sale: month rollover first, then the sale itself. If the rollover
   * removes the advisor from the system the sale is not counted.
   */
  public static List<PhaseTransition> applySaleEvent(
      AdvisorPhaseState state, YearMonth currentMonth, PhaseConfig config) {
    var transitions = new ArrayList<PhaseTransition>();
    transitions.addAll(applyMonthRollover(state, currentMonth, config));
    if (!state.isEnrolled()) {
      return transitions;
    }
    transitions.addAll(applySale(state, currentMonth));
    return transitions;
  }

  /**
   * Settles the tracked month if {@code currentMonth} differs from it. A month without sales costs
   * the advisor a solitary month (removal once {@code maxSolitaryMonths} is reached), a phase-1
   * attempt (solitary mode once {@code attemptsPhase1} is reached) or one phase. The monthly sale
   * counter then restarts for {@code currentMonth}.
   */
  public static List<PhaseTransition> applyMonthRollover(
      AdvisorPhaseState state, YearMonth currentMonth, PhaseConfig config) {
    String trackedMonth = state.getTrackingMonth();
    if (currentMonth.toString().equals(trackedMonth)) {
      return List.of();
    }
    if (trackedMonth == null) {
      // nothing was being tracked, so there is no month to judge
      state.startTrackingMonth(currentMonth);
      return List.of();
    }

    var transitions = new ArrayList<PhaseTransition>();
    if (state.getSalesThisMonth() == 0) {
      int phase = state.getCurrentPhase();
      if (state.isSolitary()) {
        int months = state.getSolitaryMonthsWithoutSale() + 1;
        state.setSolitaryMonthsWithoutSale(months);
        if (months >= config.getMaxSolitaryMonths()) {
          state.exit();
          transitions.add(
              PhaseTransition.rollover(
                  phase,
                  SOLITARY_PHASE,
                  PhaseChangeType.EXIT,
                  "No sales for " + months + " months in solitary mode"));
        }
      } else if (phase == FIRST_PHASE) {
        int attempts = state.getPhase1AttemptsUsed() + 1;
        if (attempts >= config.getAttemptsPhase1()) {
          state.enterSolitary();
          transitions.add(
              PhaseTransition.rollover(
                  FIRST_PHASE,
                  SOLITARY_PHASE,
                  PhaseChangeType.ENTER_SOLITARY,
                  "No sales in phase 1"));
        } else {
          state.setPhase1AttemptsUsed(attempts);
        }
      } else if (phase > FIRST_PHASE) {
        state.moveToPhase(phase - 1);
        transitions.add(
            PhaseTransition.rollover(
                phase, phase - 1, PhaseChangeType.DEMOTE, "No sales during the month"));
      }
    }
    state.startTrackingMonth(currentMonth);
    return transitions;
  }

  /**
   * Counts a sale in the current month and moves the advisor up: out of solitary mode straight to
   * phase 1, one phase up below phase 5, or towards PRESTIGE/ULTRA at phase 5.
   */
  public static List<PhaseTransition> applySale(AdvisorPhaseState state, YearMonth currentMonth) {
    state.countSale();

    if (state.isSolitary()) {
      state.exitSolitary();
      return List.of(
          PhaseTransition.sale(
              SOLITARY_PHASE,
              FIRST_PHASE,
              PhaseChangeType.EXIT_SOLITARY,
              "Sale closed in solitary mode"));
    }

    int phase = state.getCurrentPhase();
    if (phase < TOP_PHASE) {
      state.moveToPhase(phase + 1);
      return List.of(
          PhaseTransition.sale(phase, phase + 1, PhaseChangeType.ADVANCE, "Sale closed"));
    }
    return applyTopPhaseSale(state, currentMonth);
  }

  private static List<PhaseTransition> applyTopPhaseSale(
      AdvisorPhaseState state, YearMonth currentMonth) {
    int previousPrestige = state.getPrestige();
    int previousUltra = state.getUltraRecord();

    int counter = state.getPhase5SaleCounter() + 1;
    state.addPrestige(counter / SALES_PER_PRESTIGE);
    state.setPhase5SaleCounter(counter % SALES_PER_PRESTIGE);

    int monthlySales = state.getSalesThisMonth();
    if (monthlySales > previousUltra) {
      state.recordUltra(monthlySales, currentMonth);
    }

    int prestige = state.getPrestige();
    int ultra = state.getUltraRecord();
    if (prestige == previousPrestige && ultra == previousUltra) {
      return List.of();
    }
    var changeType = prestige > previousPrestige ? PhaseChangeType.PRESTIGE : PhaseChangeType.ULTRA;
    return List.of(
        new PhaseTransition(
            TOP_PHASE,
            TOP_PHASE,
            changeType,
            "PRESTIGE: " + prestige + ", ULTRA: " + ultra,
            true,
            prestige,
            ultra));
  }
}
