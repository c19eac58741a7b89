package io.realtycrm.backend.poollead;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tenants/{tenantId}/phase-system/leads")
public class PoolLeadController {

  private final PoolLeadService poolLeadService;

  public PoolLeadController(PoolLeadService poolLeadService) {
    this.poolLeadService = poolLeadService;
  }

  @GetMapping
  public ResponseEntity<List<PoolLeadView>> listPoolLeads(
      @PathVariable UUID tenantId,
      @RequestParam(required = false) Boolean assigned,
      @RequestParam(required = false) String source,
      @RequestParam(required = false) UUID advisorId) {
    return ResponseEntity.ok(poolLeadService.listPoolLeads(tenantId, assigned, source, advisorId));
  }

  @PostMapping("/mark")
  public ResponseEntity<PoolLeadView> markAsPoolLead(
      @PathVariable UUID tenantId, @Valid @RequestBody MarkPoolLeadRequest request) {
    return ResponseEntity.ok(
        poolLeadService.markAsPoolLead(tenantId, request.contactId(), request.source()));
  }

  @PostMapping("/assign")
  public ResponseEntity<PoolLeadView> assignLead(
      @PathVariable UUID tenantId, @Valid @RequestBody AssignLeadRequest request) {
    return ResponseEntity.ok(
        poolLeadService.assignLead(tenantId, request.contactId(), request.advisorId()));
  }

  @PostMapping("/{contactId}/auto-assign")
  public ResponseEntity<PoolLeadView> autoAssign(
      @PathVariable UUID tenantId, @PathVariable UUID contactId) {
    return ResponseEntity.ok(poolLeadService.autoAssign(tenantId, contactId));
  }

  @GetMapping("/select-advisor")
  public ResponseEntity<SelectedAdvisorResponse> selectAdvisor(@PathVariable UUID tenantId) {
    var advisorId = poolLeadService.selectAdvisorForLead(tenantId);
    return ResponseEntity.ok(new SelectedAdvisorResponse(advisorId.orElse(null)));
  }

  // --- DTOs ---

  public record MarkPoolLeadRequest(
      @NotNull(message = "contactId is required") UUID contactId,
      @Size(max = 50, message = "source must be at most 50 characters") String source) {}

  public record AssignLeadRequest(
      @NotNull(message = "contactId is required") UUID contactId,
      @NotNull(message = "advisorId is required") UUID advisorId) {}

  /** {@code userId} is null when no advisor is eligible. */
  public record SelectedAdvisorResponse(UUID userId) {}
}
