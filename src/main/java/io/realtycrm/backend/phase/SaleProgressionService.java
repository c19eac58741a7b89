package io.realtycrm.backend.phase;

import io.realtycrm.backend.member.TenantMembershipRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Drives the phase state machine when a sale closes. Invoked by the sales flow after the sale is
 * persisted; the sale itself is only referenced by id in the history.
 */
@Service
public class SaleProgressionService {

  private static final Logger log = LoggerFactory.getLogger(SaleProgressionService.class);

  private final PhaseConfigRepository phaseConfigRepository;
  private final TenantMembershipRepository membershipRepository;
  private final PhaseHistoryService phaseHistoryService;
  private final Clock clock;

  public SaleProgressionService(
      PhaseConfigRepository phaseConfigRepository,
      TenantMembershipRepository membershipRepository,
      PhaseHistoryService phaseHistoryService,
      Clock clock) {
    this.phaseConfigRepository = phaseConfigRepository;
    this.membershipRepository = membershipRepository;
    this.phaseHistoryService = phaseHistoryService;
    this.clock = clock;
  }

  /**
   * Applies a closed sale to the advisor's phase state: pending month rollover first, then the
   * sale. Runs as one transaction holding a row lock on the advisor's membership, so concurrent
   * sales for the same advisor are serialised and the state change commits with its history.
   *
   * <p>Ignored without error when the tenant has no phase config or the advisor is not enrolled.
   */
  @Transactional
  public SaleOutcome processSale(UUID tenantId, UUID userId, UUID saleId, boolean poolLead) {
    var config = phaseConfigRepository.findByTenantId(tenantId);
    if (config.isEmpty()) {
      log.debug("Tenant {} has no phase config, ignoring sale {}", tenantId, saleId);
      return SaleOutcome.ignored(userId, saleId, poolLead);
    }

    var membership = membershipRepository.findByTenantIdAndUserIdForUpdate(tenantId, userId);
    if (membership.isEmpty() || !membership.get().getPhaseState().isEnrolled()) {
      log.debug(
          "Advisor {} is not enrolled in the phase system of tenant {}, ignoring sale {}",
          userId,
          tenantId,
          saleId);
      return SaleOutcome.ignored(userId, saleId, poolLead);
    }

    var advisor = membership.get();
    var state = advisor.getPhaseState();
    int phaseBefore = state.getCurrentPhase();

    var transitions =
        PhaseProgression.applySaleEvent(state, YearMonth.now(clock), config.get());

    advisor.touch(Instant.now(clock));
    membershipRepository.save(advisor);
    phaseHistoryService.record(tenantId, userId, transitions, saleId);

    log.info(
        "Processed sale {} (poolLead={}) for advisor {}: phase {} -> {}, prestige={}, enrolled={}",
        saleId,
        poolLead,
        userId,
        phaseBefore,
        state.getCurrentPhase(),
        state.getPrestige(),
        state.isEnrolled());
    return new SaleOutcome(userId, saleId, true, poolLead, transitions, state);
  }
}
