package io.realtycrm.backend.phase;

import io.realtycrm.backend.config.PhaseSystemProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tenants/{tenantId}/phase-system")
public class AdvisorPhaseController {

  private final AdvisorPhaseService advisorPhaseService;
  private final PhaseConfigService phaseConfigService;
  private final PhaseSystemProperties properties;

  public AdvisorPhaseController(
      AdvisorPhaseService advisorPhaseService,
      PhaseConfigService phaseConfigService,
      PhaseSystemProperties properties) {
    this.advisorPhaseService = advisorPhaseService;
    this.phaseConfigService = phaseConfigService;
    this.properties = properties;
  }

  @GetMapping("/advisors")
  public ResponseEntity<AdvisorListResponse> listAdvisors(
      @PathVariable UUID tenantId, @RequestParam(defaultValue = "false") boolean enrolledOnly) {
    var advisors =
        enrolledOnly
            ? advisorPhaseService.listEnrolled(tenantId)
            : advisorPhaseService.listAll(tenantId);
    var thresholds =
        phaseConfigService
            .getConfig(tenantId)
            .map(c -> new Thresholds(c.getAttemptsPhase1(), c.getMaxSolitaryMonths()))
            .orElse(null);
    return ResponseEntity.ok(new AdvisorListResponse(advisors, thresholds));
  }

  @PostMapping("/advisors")
  public ResponseEntity<AdvisorPhaseView> enroll(
      @PathVariable UUID tenantId, @Valid @RequestBody EnrollAdvisorRequest request) {
    var advisor = advisorPhaseService.enroll(tenantId, request.userId());
    return ResponseEntity.created(
            URI.create(
                "/api/tenants/" + tenantId + "/phase-system/advisors/" + request.userId()))
        .body(advisor);
  }

  @DeleteMapping("/advisors/{userId}")
  public ResponseEntity<Void> unenroll(@PathVariable UUID tenantId, @PathVariable UUID userId) {
    advisorPhaseService.unenroll(tenantId, userId);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/advisors/{userId}/history")
  public ResponseEntity<List<PhaseHistoryResponse>> history(
      @PathVariable UUID tenantId,
      @PathVariable UUID userId,
      @RequestParam(required = false) Integer limit) {
    int effectiveLimit = limit != null && limit > 0 ? limit : properties.historyLimit();
    var entries = advisorPhaseService.history(tenantId, userId, effectiveLimit);
    return ResponseEntity.ok(entries.stream().map(PhaseHistoryResponse::from).toList());
  }

  @GetMapping("/statistics")
  public ResponseEntity<PhaseSystemStats> statistics(@PathVariable UUID tenantId) {
    return ResponseEntity.ok(advisorPhaseService.statistics(tenantId));
  }

  @GetMapping("/ranking")
  public ResponseEntity<List<AdvisorPhaseView>> ranking(
      @PathVariable UUID tenantId, @RequestParam(required = false) Integer limit) {
    int effectiveLimit = limit != null && limit > 0 ? limit : properties.rankingLimit();
    return ResponseEntity.ok(advisorPhaseService.ranking(tenantId, effectiveLimit));
  }

  // --- DTOs ---

  public record EnrollAdvisorRequest(@NotNull(message = "userId is required") UUID userId) {}

  /** Phase-1 attempt and solitary-month limits, shown next to the advisors' counters. */
  public record Thresholds(int attemptsPhase1, int maxSolitaryMonths) {}

  public record AdvisorListResponse(List<AdvisorPhaseView> advisors, Thresholds thresholds) {}

  public record PhaseHistoryResponse(
      UUID id,
      UUID userId,
      Integer previousPhase,
      int newPhase,
      String changeType,
      String reason,
      UUID saleId,
      Integer prestigeValue,
      Integer ultraValue,
      Instant createdAt) {

    public static PhaseHistoryResponse from(PhaseHistoryEntry entry) {
      return new PhaseHistoryResponse(
          entry.getId(),
          entry.getUserId(),
          entry.getPreviousPhase(),
          entry.getNewPhase(),
          entry.getChangeType().name(),
          entry.getReason(),
          entry.getSaleId(),
          entry.getPrestigeValue(),
          entry.getUltraValue(),
          entry.getCreatedAt());
    }
  }
}
