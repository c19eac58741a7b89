package io.realtycrm.backend.phase;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Entry point for the sales module: reports a closed sale to the phase system. */
@RestController
@RequestMapping("/api/tenants/{tenantId}/phase-system")
public class SaleEventController {

  private final SaleProgressionService saleProgressionService;

  public SaleEventController(SaleProgressionService saleProgressionService) {
    this.saleProgressionService = saleProgressionService;
  }

  @PostMapping("/sales")
  public ResponseEntity<SaleOutcomeResponse> processSale(
      @PathVariable UUID tenantId, @Valid @RequestBody SaleEventRequest request) {
    var outcome =
        saleProgressionService.processSale(
            tenantId,
            request.userId(),
            request.saleId(),
            Boolean.TRUE.equals(request.poolLead()));
    return ResponseEntity.ok(SaleOutcomeResponse.from(outcome));
  }

  // --- DTOs ---

  public record SaleEventRequest(
      @NotNull(message = "userId is required") UUID userId,
      @NotNull(message = "saleId is required") UUID saleId,
      Boolean poolLead) {}

  public record TransitionResponse(
      Integer previousPhase,
      int newPhase,
      String changeType,
      String reason,
      Integer prestigeValue,
      Integer ultraValue) {

    static TransitionResponse from(PhaseTransition t) {
      return new TransitionResponse(
          t.previousPhase(),
          t.newPhase(),
          t.changeType().name(),
          t.reason(),
          t.prestigeValue(),
          t.ultraValue());
    }
  }

  public record SaleOutcomeResponse(
      UUID userId,
      UUID saleId,
      boolean processed,
      boolean poolLead,
      List<TransitionResponse> transitions,
      Integer currentPhase,
      Boolean solitary,
      Integer prestige,
      Integer ultraRecord,
      Integer salesThisMonth) {

    public static SaleOutcomeResponse from(SaleOutcome outcome) {
      var state = outcome.state();
      return new SaleOutcomeResponse(
          outcome.userId(),
          outcome.saleId(),
          outcome.processed(),
          outcome.poolLead(),
          outcome.transitions().stream().map(TransitionResponse::from).toList(),
          state != null ? state.getCurrentPhase() : null,
          state != null ? state.isSolitary() : null,
          state != null ? state.getPrestige() : null,
          state != null ? state.getUltraRecord() : null,
          state != null ? state.getSalesThisMonth() : null);
    }
  }
}
