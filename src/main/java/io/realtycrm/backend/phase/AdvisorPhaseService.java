package io.realtycrm.backend.phase;

import io.realtycrm.backend.audit.AuditEventBuilder;
import io.realtycrm.backend.audit.AuditService;
import io.realtycrm.backend.contact.ContactRepository;
import io.realtycrm.backend.exception.ResourceNotFoundException;
import io.realtycrm.backend.member.AdvisorNameResolver;
import io.realtycrm.backend.member.TenantMembership;
import io.realtycrm.backend.member.TenantMembershipRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Enrollment, removal and read projections of advisors in the phase system. */
@Service
public class AdvisorPhaseService {

  private static final Logger log = LoggerFactory.getLogger(AdvisorPhaseService.class);

  private final TenantMembershipRepository membershipRepository;
  private final ContactRepository contactRepository;
  private final AdvisorNameResolver advisorNameResolver;
  private final PhaseHistoryService phaseHistoryService;
  private final AuditService auditService;
  private final Clock clock;

  public AdvisorPhaseService(
      TenantMembershipRepository membershipRepository,
      ContactRepository contactRepository,
      AdvisorNameResolver advisorNameResolver,
      PhaseHistoryService phaseHistoryService,
      AuditService auditService,
      Clock clock) {
    this.membershipRepository = membershipRepository;
    this.contactRepository = contactRepository;
    this.advisorNameResolver = advisorNameResolver;
    this.phaseHistoryService = phaseHistoryService;
    this.auditService = auditService;
    this.clock = clock;
  }

  /**
   * Enrolls the advisor at phase 1 with all attempt and monthly counters cleared. Running it again
   * gives the same state apart from a fresh enrollment timestamp.
   *
   * @throws ResourceNotFoundException if the user is not a member of the tenant
   */
  @Transactional
  public AdvisorPhaseView enroll(UUID tenantId, UUID userId) {
    var membership = requireMembershipForUpdate(tenantId, userId);
    Instant now = Instant.now(clock);

    membership.getPhaseState().enroll(YearMonth.now(clock), now);
    membership.touch(now);
    membershipRepository.save(membership);

    phaseHistoryService.record(
        tenantId,
        userId,
        List.of(
            new PhaseTransition(
                null,
                AdvisorPhaseState.FIRST_PHASE,
                PhaseChangeType.ENROLL,
                "Enrolled in the phase system",
                false,
                null,
                null)),
        null);
    auditMembership(tenantId, membership, "phase_membership.enrolled");
    log.info("Enrolled advisor {} in the phase system of tenant {}", userId, tenantId);

    var user = advisorNameResolver.resolveUsers(List.of(userId)).get(userId);
    return AdvisorPhaseView.from(membership, user);
  }

  /**
   * Takes the advisor out of the phase system, recording the phase held at removal. Removing an
   * advisor who is not enrolled does nothing.
   *
   * @throws ResourceNotFoundException if the user is not a member of the tenant
   */
  @Transactional
  public void unenroll(UUID tenantId, UUID userId) {
    var membership = requireMembershipForUpdate(tenantId, userId);
    var state = membership.getPhaseState();
    if (!state.isEnrolled()) {
      log.debug("Advisor {} of tenant {} is not enrolled, nothing to remove", userId, tenantId);
      return;
    }

    int phaseAtRemoval = state.getCurrentPhase();
    state.exit();
    membership.touch(Instant.now(clock));
    membershipRepository.save(membership);

    phaseHistoryService.record(
        tenantId,
        userId,
        List.of(
            new PhaseTransition(
                phaseAtRemoval,
                AdvisorPhaseState.SOLITARY_PHASE,
                PhaseChangeType.EXIT,
                "Removed from the phase system",
                false,
                null,
                null)),
        null);
    auditMembership(tenantId, membership, "phase_membership.removed");
    log.info("Removed advisor {} from the phase system of tenant {}", userId, tenantId);
  }

  /** Every active member of the tenant, enrolled advisors first. */
  @Transactional(readOnly = true)
  public List<AdvisorPhaseView> listAll(UUID tenantId) {
    return toViews(membershipRepository.findActive(tenantId));
  }

  @Transactional(readOnly = true)
  public List<AdvisorPhaseView> listEnrolled(UUID tenantId) {
    return toViews(membershipRepository.findEnrolled(tenantId));
  }

  /** Enrolled advisors by prestige, phase, ULTRA record and sales of the month. */
  @Transactional(readOnly = true)
  public List<AdvisorPhaseView> ranking(UUID tenantId, int limit) {
    return toViews(membershipRepository.findRanking(tenantId, PageRequest.of(0, limit)));
  }

  /** Newest-first phase history of an advisor. */
  @Transactional(readOnly = true)
  public List<PhaseHistoryEntry> history(UUID tenantId, UUID userId, int limit) {
    return phaseHistoryService.listForAdvisor(tenantId, userId, limit);
  }

  @Transactional(readOnly = true)
  public PhaseSystemStats statistics(UUID tenantId) {
    var enrolled = membershipRepository.findEnrolled(tenantId);
    long[] byPhase = new long[AdvisorPhaseState.TOP_PHASE + 1];
    long solitary = 0;
    long totalPrestige = 0;
    int maxUltra = 0;
    for (TenantMembership membership : enrolled) {
      var state = membership.getPhaseState();
      byPhase[state.getCurrentPhase()]++;
      if (state.isSolitary()) solitary++;
      totalPrestige += state.getPrestige();
      maxUltra = Math.max(maxUltra, state.getUltraRecord());
    }

    var leads = contactRepository.countPoolLeads(tenantId);
    long totalLeads = leads != null ? leads.getTotal() : 0;
    long assignedLeads = leads != null ? leads.getAssigned() : 0;

    return new PhaseSystemStats(
        enrolled.size(),
        byPhase[1],
        byPhase[2],
        byPhase[3],
        byPhase[4],
        byPhase[5],
        solitary,
        totalPrestige,
        maxUltra,
        totalLeads,
        assignedLeads,
        totalLeads - assignedLeads);
  }

  private TenantMembership requireMembershipForUpdate(UUID tenantId, UUID userId) {
    return membershipRepository
        .findByTenantIdAndUserIdForUpdate(tenantId, userId)
        .orElseThrow(() -> ResourceNotFoundException.inTenant("Membership", userId, tenantId));
  }

  private List<AdvisorPhaseView> toViews(List<TenantMembership> memberships) {
    var users =
        advisorNameResolver.resolveUsers(
            memberships.stream().map(TenantMembership::getUserId).toList());
    return memberships.stream()
        .map(m -> AdvisorPhaseView.from(m, users.get(m.getUserId())))
        .toList();
  }

  private void auditMembership(UUID tenantId, TenantMembership membership, String eventType) {
    var state = membership.getPhaseState();
    auditService.log(
        AuditEventBuilder.builder()
            .tenantId(tenantId)
            .eventType(eventType)
            .entityType("tenant_membership")
            .entityId(membership.getId())
            .details(
                Map.of(
                    "user_id", membership.getUserId().toString(),
                    "current_phase", state.getCurrentPhase(),
                    "prestige", state.getPrestige()))
            .build());
  }
}
