package io.realtycrm.backend.phase;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.realtycrm.backend.audit.AuditEventRecord;
import io.realtycrm.backend.audit.AuditService;
import io.realtycrm.backend.contact.ContactRepository;
import io.realtycrm.backend.exception.ResourceNotFoundException;
import io.realtycrm.backend.member.AdvisorNameResolver;
import io.realtycrm.backend.member.AppUser;
import io.realtycrm.backend.member.TenantMembership;
import io.realtycrm.backend.member.TenantMembershipRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

@ExtendWith(MockitoExtension.class)
class AdvisorPhaseServiceTest {

  private static final UUID TENANT_ID = UUID.randomUUID();
  private static final UUID USER_ID = UUID.randomUUID();
  private static final Instant NOW = Instant.parse("2025-03-03T09:00:00Z");

  @Mock private TenantMembershipRepository membershipRepository;
  @Mock private ContactRepository contactRepository;
  @Mock private AdvisorNameResolver advisorNameResolver;
  @Mock private PhaseHistoryService phaseHistoryService;
  @Mock private AuditService auditService;
  @Captor private ArgumentCaptor<List<PhaseTransition>> transitionsCaptor;
  @Captor private ArgumentCaptor<AuditEventRecord> auditCaptor;

  private AdvisorPhaseService service;

  @BeforeEach
  void setUp() {
    service =
        new AdvisorPhaseService(
            membershipRepository,
            contactRepository,
            advisorNameResolver,
            phaseHistoryService,
            auditService,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void enroll_startsAtPhaseOneAndRecordsHistory() {
    var membership = new TenantMembership(TENANT_ID, USER_ID);
    var user = new AppUser("Ana", "Reyes", "ana@realty.test");
    when(membershipRepository.findByTenantIdAndUserIdForUpdate(TENANT_ID, USER_ID))
        .thenReturn(Optional.of(membership));
    when(advisorNameResolver.resolveUsers(List.of(USER_ID))).thenReturn(Map.of(USER_ID, user));

    var view = service.enroll(TENANT_ID, USER_ID);

    assertThat(view.enrolled()).isTrue();
    assertThat(view.currentPhase()).isEqualTo(1);
    assertThat(view.trackingMonth()).isEqualTo("2025-03");
    assertThat(view.enrolledAt()).isEqualTo(NOW);
    assertThat(view.firstName()).isEqualTo("Ana");
    verify(membershipRepository).save(membership);
    verify(phaseHistoryService)
        .record(eq(TENANT_ID), eq(USER_ID), transitionsCaptor.capture(), isNull());
    assertThat(transitionsCaptor.getValue())
        .singleElement()
        .satisfies(
            t -> {
              assertThat(t.changeType()).isEqualTo(PhaseChangeType.ENROLL);
              assertThat(t.previousPhase()).isNull();
              assertThat(t.newPhase()).isEqualTo(1);
            });
    verify(auditService).log(auditCaptor.capture());
    assertThat(auditCaptor.getValue().eventType()).isEqualTo("phase_membership.enrolled");
    assertThat(auditCaptor.getValue().source()).isEqualTo("INTERNAL");
  }

  @Test
  void enroll_twiceGivesSameStateAndKeepsPrestige() {
    var membership = new TenantMembership(TENANT_ID, USER_ID);
    var state = membership.getPhaseState();
    state.enroll(YearMonth.of(2025, 1), NOW.minusSeconds(3600));
    state.moveToPhase(5);
    state.addPrestige(2);
    state.countSale();
    when(membershipRepository.findByTenantIdAndUserIdForUpdate(TENANT_ID, USER_ID))
        .thenReturn(Optional.of(membership));
    when(advisorNameResolver.resolveUsers(List.of(USER_ID))).thenReturn(Map.of());

    var first = service.enroll(TENANT_ID, USER_ID);
    var second = service.enroll(TENANT_ID, USER_ID);

    assertThat(second).isEqualTo(first);
    assertThat(second.currentPhase()).isEqualTo(1);
    assertThat(second.salesThisMonth()).isZero();
    assertThat(second.prestige()).isEqualTo(2);
  }

  @Test
  void enroll_unknownMembershipIsNotFound() {
    when(membershipRepository.findByTenantIdAndUserIdForUpdate(TENANT_ID, USER_ID))
        .thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.enroll(TENANT_ID, USER_ID))
        .isInstanceOf(ResourceNotFoundException.class);
    verifyNoInteractions(phaseHistoryService, auditService);
  }

  @Test
  void unenroll_recordsPhaseAtRemoval() {
    var membership = new TenantMembership(TENANT_ID, USER_ID);
    membership.getPhaseState().enroll(YearMonth.of(2025, 3), NOW);
    membership.getPhaseState().moveToPhase(3);
    when(membershipRepository.findByTenantIdAndUserIdForUpdate(TENANT_ID, USER_ID))
        .thenReturn(Optional.of(membership));

    service.unenroll(TENANT_ID, USER_ID);

    assertThat(membership.getPhaseState().isEnrolled()).isFalse();
    verify(phaseHistoryService)
        .record(eq(TENANT_ID), eq(USER_ID), transitionsCaptor.capture(), isNull());
    assertThat(transitionsCaptor.getValue())
        .singleElement()
        .satisfies(
            t -> {
              assertThat(t.changeType()).isEqualTo(PhaseChangeType.EXIT);
              assertThat(t.previousPhase()).isEqualTo(3);
              assertThat(t.newPhase()).isZero();
            });
  }

  @Test
  void unenroll_notEnrolledIsNoOp() {
    when(membershipRepository.findByTenantIdAndUserIdForUpdate(TENANT_ID, USER_ID))
        .thenReturn(Optional.of(new TenantMembership(TENANT_ID, USER_ID)));

    service.unenroll(TENANT_ID, USER_ID);

    verify(membershipRepository, never()).save(any());
    verifyNoInteractions(phaseHistoryService, auditService);
  }

  @Test
  void ranking_requestsFirstPageOfLimit() {
    var membership = new TenantMembership(TENANT_ID, USER_ID);
    when(membershipRepository.findRanking(TENANT_ID, PageRequest.of(0, 3)))
        .thenReturn(List.of(membership));
    when(advisorNameResolver.resolveUsers(List.of(USER_ID))).thenReturn(Map.of());

    var ranking = service.ranking(TENANT_ID, 3);

    assertThat(ranking).extracting(AdvisorPhaseView::userId).containsExactly(USER_ID);
  }

  @Test
  void statistics_countsPhasesAndLeads() {
    var phaseTwo = enrolled(2, 0, 3);
    var phaseFive = enrolled(5, 4, 9);
    var solitary = enrolled(1, 0, 0);
    solitary.getPhaseState().enterSolitary();
    when(membershipRepository.findEnrolled(TENANT_ID))
        .thenReturn(List.of(phaseFive, phaseTwo, solitary));
    var counts = mock(ContactRepository.PoolLeadCounts.class);
    when(counts.getTotal()).thenReturn(7L);
    when(counts.getAssigned()).thenReturn(5L);
    when(contactRepository.countPoolLeads(TENANT_ID)).thenReturn(counts);

    var stats = service.statistics(TENANT_ID);

    assertThat(stats.enrolledAdvisors()).isEqualTo(3);
    assertThat(stats.phase2Advisors()).isEqualTo(1);
    assertThat(stats.phase5Advisors()).isEqualTo(1);
    assertThat(stats.phase1Advisors()).isZero();
    assertThat(stats.solitaryAdvisors()).isEqualTo(1);
    assertThat(stats.totalPrestige()).isEqualTo(4);
    assertThat(stats.maxUltra()).isEqualTo(9);
    assertThat(stats.totalLeads()).isEqualTo(7);
    assertThat(stats.assignedLeads()).isEqualTo(5);
    assertThat(stats.pendingLeads()).isEqualTo(2);
  }

  private static TenantMembership enrolled(int phase, int prestige, int ultra) {
    var membership = new TenantMembership(TENANT_ID, UUID.randomUUID());
    var state = membership.getPhaseState();
    state.enroll(YearMonth.of(2025, 3), NOW);
    state.moveToPhase(phase);
    state.addPrestige(prestige);
    state.recordUltra(ultra, YearMonth.of(2025, 2));
    return membership;
  }
}
