package io.realtycrm.backend.phase;

import io.realtycrm.backend.audit.AuditEvent;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tenants/{tenantId}/phase-system")
public class PhaseConfigController {

  private final PhaseConfigService phaseConfigService;

  public PhaseConfigController(PhaseConfigService phaseConfigService) {
    this.phaseConfigService = phaseConfigService;
  }

  @GetMapping("/config")
  public ResponseEntity<PhaseConfigResponse> getConfig(@PathVariable UUID tenantId) {
    var config = phaseConfigService.getOrCreateConfig(tenantId);
    return ResponseEntity.ok(PhaseConfigResponse.from(config));
  }

  @PutMapping("/config")
  public ResponseEntity<PhaseConfigResponse> upsertConfig(
      @PathVariable UUID tenantId, @Valid @RequestBody UpdatePhaseConfigRequest request) {
    var config = phaseConfigService.upsertConfig(tenantId, request.toChanges());
    return ResponseEntity.ok(PhaseConfigResponse.from(config));
  }

  @PostMapping("/toggle")
  public ResponseEntity<PhaseConfigResponse> toggle(
      @PathVariable UUID tenantId, @Valid @RequestBody ToggleRequest request) {
    var config = phaseConfigService.toggleActive(tenantId, request.active());
    return ResponseEntity.ok(PhaseConfigResponse.from(config));
  }

  @GetMapping("/commission-split")
  public ResponseEntity<CommissionSplit> commissionSplit(
      @PathVariable UUID tenantId, @RequestParam BigDecimal amount) {
    return ResponseEntity.ok(phaseConfigService.commissionSplit(tenantId, amount));
  }

  @GetMapping("/config/audit")
  public ResponseEntity<List<AuditEventResponse>> configAudit(@PathVariable UUID tenantId) {
    var events = phaseConfigService.auditTrail(tenantId);
    return ResponseEntity.ok(events.stream().map(AuditEventResponse::from).toList());
  }

  // --- DTOs ---

  public record UpdatePhaseConfigRequest(
      UUID poolPropertyId,
      @DecimalMin(value = "0", message = "advisorCommissionPct must not be negative")
          @DecimalMax(value = "100", message = "advisorCommissionPct must be at most 100")
          @Digits(integer = 3, fraction = 2, message = "advisorCommissionPct allows 2 decimals")
          BigDecimal advisorCommissionPct,
      @DecimalMin(value = "0", message = "companyCommissionPct must not be negative")
          @DecimalMax(value = "100", message = "companyCommissionPct must be at most 100")
          @Digits(integer = 3, fraction = 2, message = "companyCommissionPct allows 2 decimals")
          BigDecimal companyCommissionPct,
      @PositiveOrZero(message = "phase1Weight must not be negative") Integer phase1Weight,
      @PositiveOrZero(message = "phase2Weight must not be negative") Integer phase2Weight,
      @PositiveOrZero(message = "phase3Weight must not be negative") Integer phase3Weight,
      @PositiveOrZero(message = "phase4Weight must not be negative") Integer phase4Weight,
      @PositiveOrZero(message = "phase5Weight must not be negative") Integer phase5Weight,
      @Min(value = 1, message = "attemptsPhase1 must be at least 1") Integer attemptsPhase1,
      @Min(value = 1, message = "maxSolitaryMonths must be at least 1")
          Integer maxSolitaryMonths) {

    PhaseConfigChanges toChanges() {
      return new PhaseConfigChanges(
          poolPropertyId,
          advisorCommissionPct,
          companyCommissionPct,
          phase1Weight,
          phase2Weight,
          phase3Weight,
          phase4Weight,
          phase5Weight,
          attemptsPhase1,
          maxSolitaryMonths);
    }
  }

  public record ToggleRequest(@NotNull(message = "active is required") Boolean active) {}

  public record PhaseConfigResponse(
      UUID id,
      UUID tenantId,
      boolean active,
      UUID poolPropertyId,
      BigDecimal advisorCommissionPct,
      BigDecimal companyCommissionPct,
      int phase1Weight,
      int phase2Weight,
      int phase3Weight,
      int phase4Weight,
      int phase5Weight,
      int attemptsPhase1,
      int maxSolitaryMonths,
      Instant createdAt,
      Instant updatedAt) {

    public static PhaseConfigResponse from(PhaseConfig config) {
      return new PhaseConfigResponse(
          config.getId(),
          config.getTenantId(),
          config.isActive(),
          config.getPoolPropertyId(),
          config.getAdvisorCommissionPct(),
          config.getCompanyCommissionPct(),
          config.getPhase1Weight(),
          config.getPhase2Weight(),
          config.getPhase3Weight(),
          config.getPhase4Weight(),
          config.getPhase5Weight(),
          config.getAttemptsPhase1(),
          config.getMaxSolitaryMonths(),
          config.getCreatedAt(),
          config.getUpdatedAt());
    }
  }

  public record AuditEventResponse(
      UUID id,
      String eventType,
      String actorType,
      String source,
      String details,
      Instant occurredAt) {

    public static AuditEventResponse from(AuditEvent event) {
      return new AuditEventResponse(
          event.getId(),
          event.getEventType(),
          event.getActorType(),
          event.getSource(),
          event.getDetails(),
          event.getOccurredAt());
    }
  }
}
