package io.realtycrm.backend.phase;

import io.realtycrm.backend.member.AppUser;
import io.realtycrm.backend.member.TenantMembership;
import java.time.Instant;
import java.util.UUID;

/** Read model of an advisor's phase-system state joined with the user's name and email. */
public record AdvisorPhaseView(
    UUID userId,
    UUID tenantId,
    String firstName,
    String lastName,
    String email,
    boolean enrolled,
    int currentPhase,
    boolean solitary,
    int phase1AttemptsUsed,
    int solitaryMonthsWithoutSale,
    int prestige,
    int phase5SaleCounter,
    int ultraRecord,
    String ultraMonth,
    int salesThisMonth,
    String trackingMonth,
    Instant enrolledAt) {

  public static AdvisorPhaseView from(TenantMembership membership, AppUser user) {
    var state = membership.getPhaseState();
    return new AdvisorPhaseView(
        membership.getUserId(),
        membership.getTenantId(),
        user != null ? user.getFirstName() : null,
        user != null ? user.getLastName() : null,
        user != null ? user.getEmail() : null,
        state.isEnrolled(),
        state.getCurrentPhase(),
        state.isSolitary(),
        state.getPhase1AttemptsUsed(),
        state.getSolitaryMonthsWithoutSale(),
        state.getPrestige(),
        state.getPhase5SaleCounter(),
        state.getUltraRecord(),
        state.getUltraMonth(),
        state.getSalesThisMonth(),
        state.getTrackingMonth(),
        state.getEnrolledAt());
  }
}
