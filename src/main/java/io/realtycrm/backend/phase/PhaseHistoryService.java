package io.realtycrm.backend.phase;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Appends to and reads the phase history. Entries are never changed once written. */
@Service
public class PhaseHistoryService {

  private final PhaseHistoryRepository phaseHistoryRepository;
  private final Clock clock;

  public PhaseHistoryService(PhaseHistoryRepository phaseHistoryRepository, Clock clock) {
    this.phaseHistoryRepository = phaseHistoryRepository;
    this.clock = clock;
  }

  /**
   * Appends one entry per transition. {@code saleId} is attached only to transitions caused by the
   * sale itself; month-rollover transitions never carry it.
   */
  @Transactional
  public void record(
      UUID tenantId, UUID userId, List<PhaseTransition> transitions, UUID saleId) {
    Instant now = Instant.now(clock);
    for (PhaseTransition transition : transitions) {
      UUID entrySaleId = transition.causedBySale() ? saleId : null;
      phaseHistoryRepository.save(
          new PhaseHistoryEntry(tenantId, userId, transition, entrySaleId, now));
    }
  }

  @Transactional(readOnly = true)
  public List<PhaseHistoryEntry> listForAdvisor(UUID tenantId, UUID userId, int limit) {
    return phaseHistoryRepository.findForAdvisor(tenantId, userId, PageRequest.of(0, limit));
  }
}
