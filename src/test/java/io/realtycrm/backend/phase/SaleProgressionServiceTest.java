package io.realtycrm.backend.phase;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.realtycrm.backend.member.TenantMembership;
import io.realtycrm.backend.member.TenantMembershipRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SaleProgressionServiceTest {

  private static final UUID TENANT_ID = UUID.randomUUID();
  private static final UUID USER_ID = UUID.randomUUID();
  private static final UUID SALE_ID = UUID.randomUUID();
  private static final Instant NOW = Instant.parse("2025-02-14T15:30:00Z");

  @Mock private PhaseConfigRepository phaseConfigRepository;
  @Mock private TenantMembershipRepository membershipRepository;
  @Mock private PhaseHistoryService phaseHistoryService;
  @Captor private ArgumentCaptor<List<PhaseTransition>> transitionsCaptor;

  private SaleProgressionService service;

  @BeforeEach
  void setUp() {
    service =
        new SaleProgressionService(
            phaseConfigRepository,
            membershipRepository,
            phaseHistoryService,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void processSale_ignoredWhenTenantHasNoConfig() {
    when(phaseConfigRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.empty());

    var outcome = service.processSale(TENANT_ID, USER_ID, SALE_ID, false);

    assertThat(outcome.processed()).isFalse();
    assertThat(outcome.transitions()).isEmpty();
    verifyNoInteractions(membershipRepository, phaseHistoryService);
  }

  @Test
  void processSale_ignoredWhenAdvisorNotEnrolled() {
    when(phaseConfigRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(config()));
    when(membershipRepository.findByTenantIdAndUserIdForUpdate(TENANT_ID, USER_ID))
        .thenReturn(Optional.of(new TenantMembership(TENANT_ID, USER_ID)));

    var outcome = service.processSale(TENANT_ID, USER_ID, SALE_ID, true);

    assertThat(outcome.processed()).isFalse();
    assertThat(outcome.poolLead()).isTrue();
    verify(membershipRepository, never()).save(any());
    verifyNoInteractions(phaseHistoryService);
  }

  @Test
  void processSale_ignoredWhenAdvisorIsNotAMember() {
    when(phaseConfigRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(config()));
    when(membershipRepository.findByTenantIdAndUserIdForUpdate(TENANT_ID, USER_ID))
        .thenReturn(Optional.empty());

    var outcome = service.processSale(TENANT_ID, USER_ID, SALE_ID, false);

    assertThat(outcome.processed()).isFalse();
    verifyNoInteractions(phaseHistoryService);
  }

  @Test
  void processSale_advancesAndRecordsHistoryWithSaleId() {
    var membership = enrolledMembership(YearMonth.of(2025, 2));
    when(phaseConfigRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(config()));
    when(membershipRepository.findByTenantIdAndUserIdForUpdate(TENANT_ID, USER_ID))
        .thenReturn(Optional.of(membership));

    var outcome = service.processSale(TENANT_ID, USER_ID, SALE_ID, true);

    assertThat(outcome.processed()).isTrue();
    assertThat(outcome.state().getCurrentPhase()).isEqualTo(2);
    assertThat(outcome.state().getSalesThisMonth()).isEqualTo(1);
    assertThat(membership.getUpdatedAt()).isEqualTo(NOW);
    verify(membershipRepository).save(membership);
    verify(phaseHistoryService)
        .record(eq(TENANT_ID), eq(USER_ID), transitionsCaptor.capture(), eq(SALE_ID));
    assertThat(transitionsCaptor.getValue())
        .extracting(PhaseTransition::changeType)
        .containsExactly(PhaseChangeType.ADVANCE);
  }

  @Test
  void processSale_appliesPendingRolloverFirst() {
    var membership = enrolledMembership(YearMonth.of(2025, 1));
    membership.getPhaseState().moveToPhase(3);
    when(phaseConfigRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(config()));
    when(membershipRepository.findByTenantIdAndUserIdForUpdate(TENANT_ID, USER_ID))
        .thenReturn(Optional.of(membership));

    var outcome = service.processSale(TENANT_ID, USER_ID, SALE_ID, false);

    assertThat(outcome.transitions())
        .extracting(PhaseTransition::changeType)
        .containsExactly(PhaseChangeType.DEMOTE, PhaseChangeType.ADVANCE);
    assertThat(outcome.state().getCurrentPhase()).isEqualTo(3);
    assertThat(outcome.state().getTrackingMonth()).isEqualTo("2025-02");
    verify(phaseHistoryService).record(eq(TENANT_ID), eq(USER_ID), anyList(), eq(SALE_ID));
  }

  @Test
  void processSale_rolloverRemovalStopsTheSale() {
    var membership = enrolledMembership(YearMonth.of(2025, 1));
    var state = membership.getPhaseState();
    state.enterSolitary();
    state.setSolitaryMonthsWithoutSale(2);
    when(phaseConfigRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(config()));
    when(membershipRepository.findByTenantIdAndUserIdForUpdate(TENANT_ID, USER_ID))
        .thenReturn(Optional.of(membership));

    var outcome = service.processSale(TENANT_ID, USER_ID, SALE_ID, false);

    assertThat(outcome.state().isEnrolled()).isFalse();
    assertThat(outcome.state().getSalesThisMonth()).isZero();
    assertThat(outcome.transitions())
        .extracting(PhaseTransition::changeType)
        .containsExactly(PhaseChangeType.EXIT);
    verify(membershipRepository).save(membership);
  }

  private static PhaseConfig config() {
    return new PhaseConfig(TENANT_ID, NOW);
  }

  private static TenantMembership enrolledMembership(YearMonth trackingMonth) {
    var membership = new TenantMembership(TENANT_ID, USER_ID);
    membership.getPhaseState().enroll(trackingMonth, NOW.minusSeconds(86_400 * 40L));
    return membership;
  }
}
