package io.realtycrm.backend.phase;

import io.realtycrm.backend.audit.AuditEvent;
import io.realtycrm.backend.audit.AuditEventBuilder;
import io.realtycrm.backend.audit.AuditService;
import io.realtycrm.backend.exception.InvalidStateException;
import io.realtycrm.backend.exception.ResourceNotFoundException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PhaseConfigService {

  private static final Logger log = LoggerFactory.getLogger(PhaseConfigService.class);
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
  // matches the NUMERIC(5,2) percentage columns
  private static final int PERCENT_SCALE = 2;

  private final PhaseConfigRepository phaseConfigRepository;
  private final AuditService auditService;
  private final Clock clock;

  public PhaseConfigService(
      PhaseConfigRepository phaseConfigRepository, AuditService auditService, Clock clock) {
    this.phaseConfigRepository = phaseConfigRepository;
    this.auditService = auditService;
    this.clock = clock;
  }

  /** Returns the tenant's config, or empty when the phase system was never configured. */
  @Transactional(readOnly = true)
  public Optional<PhaseConfig> getConfig(UUID tenantId) {
    return phaseConfigRepository.findByTenantId(tenantId);
  }

  /** Returns the tenant's config, creating the default one on first access. */
  @Transactional
  public PhaseConfig getOrCreateConfig(UUID tenantId) {
    return phaseConfigRepository
        .findByTenantId(tenantId)
        .orElseGet(() -> upsertConfig(tenantId, PhaseConfigChanges.none()));
  }

  /**
   * Creates the config with defaults (active) when absent, otherwise merges the provided fields.
   * The merged result must keep weights non-negative, a commission split of at most two decimals
   * summing to 100 and positive thresholds.
   *
   * @throws InvalidStateException if the merged config breaks one of those rules
   */
  @Transactional
  public PhaseConfig upsertConfig(UUID tenantId, PhaseConfigChanges changes) {
    Instant now = Instant.now(clock);
    var existing = phaseConfigRepository.findByTenantId(tenantId);

    PhaseConfig config;
    String eventType;
    if (existing.isPresent()) {
      config = existing.get();
      eventType = "phase_config.updated";
    } else {
      config = new PhaseConfig(tenantId, now);
      eventType = "phase_config.created";
    }
    config.merge(changes, now);
    validate(config);

    config = phaseConfigRepository.save(config);
    log.info("{} phase config {} for tenant {}", eventType, config.getId(), tenantId);

    auditService.log(
        AuditEventBuilder.builder()
            .tenantId(tenantId)
            .eventType(eventType)
            .entityType("phase_config")
            .entityId(config.getId())
            .details(describe(config))
            .build());
    return config;
  }

  /** Switches the phase system on or off, creating the default config first if needed. */
  @Transactional
  public PhaseConfig toggleActive(UUID tenantId, boolean active) {
    var config = getOrCreateConfig(tenantId);
    config.setActive(active, Instant.now(clock));
    config = phaseConfigRepository.save(config);
    log.info("Phase system {} for tenant {}", active ? "activated" : "deactivated", tenantId);

    auditService.log(
        AuditEventBuilder.builder()
            .tenantId(tenantId)
            .eventType(active ? "phase_config.activated" : "phase_config.deactivated")
            .entityType("phase_config")
            .entityId(config.getId())
            .details(Map.of("active", active))
            .build());
    return config;
  }

  /**
   * Splits the commission of a pool-lead sale using the tenant's percentages.
   *
   * @throws ResourceNotFoundException if the tenant has no phase config
   * @throws InvalidStateException if {@code amount} is negative
   */
  @Transactional(readOnly = true)
  public CommissionSplit commissionSplit(UUID tenantId, BigDecimal amount) {
    if (amount == null || amount.signum() < 0) {
      throw new InvalidStateException("Invalid amount", "amount must be zero or positive");
    }
    var config =
        phaseConfigRepository
            .findByTenantId(tenantId)
            .orElseThrow(() -> ResourceNotFoundException.forTenant("Phase config", tenantId));
    return CommissionSplit.of(amount, config);
  }

  /**
   * Audit events of the tenant's phase config, newest first.
   *
   * @throws ResourceNotFoundException if the tenant has no phase config
   */
  @Transactional(readOnly = true)
  public List<AuditEvent> auditTrail(UUID tenantId) {
    var config =
        phaseConfigRepository
            .findByTenantId(tenantId)
            .orElseThrow(() -> ResourceNotFoundException.forTenant("Phase config", tenantId));
    return auditService.findForEntity(tenantId, config.getId());
  }

  private static void validate(PhaseConfig config) {
    for (int phase = 1; phase <= 5; phase++) {
      if (config.weightFor(phase) < 0) {
        throw new InvalidStateException(
            "Invalid phase config", "Weight of phase " + phase + " must not be negative");
      }
    }
    BigDecimal advisorPct = config.getAdvisorCommissionPct();
    BigDecimal companyPct = config.getCompanyCommissionPct();
    if (decimalPlaces(advisorPct) > PERCENT_SCALE || decimalPlaces(companyPct) > PERCENT_SCALE) {
      throw new InvalidStateException(
          "Invalid phase config",
          "Commission percentages allow at most " + PERCENT_SCALE + " decimal places");
    }
    if (advisorPct.signum() < 0
        || companyPct.signum() < 0
        || advisorPct.add(companyPct).compareTo(HUNDRED) != 0) {
      throw new InvalidStateException(
          "Invalid phase config",
          "advisorCommissionPct and companyCommissionPct must be non-negative and sum to 100");
    }
    if (config.getAttemptsPhase1() < 1) {
      throw new InvalidStateException(
          "Invalid phase config", "attemptsPhase1 must be at least 1");
    }
    if (config.getMaxSolitaryMonths() < 1) {
      throw new InvalidStateException(
          "Invalid phase config", "maxSolitaryMonths must be at least 1");
    }
  }

  private static int decimalPlaces(BigDecimal value) {
    return Math.max(0, value.stripTrailingZeros().scale());
  }

  private static Map<String, Object> describe(PhaseConfig config) {
    var details = new LinkedHashMap<String, Object>();
    details.put("active", config.isActive());
    details.put(
        "weights",
        new int[] {
          config.getPhase1Weight(),
          config.getPhase2Weight(),
          config.getPhase3Weight(),
          config.getPhase4Weight(),
          config.getPhase5Weight()
        });
    details.put("advisor_commission_pct", config.getAdvisorCommissionPct().toPlainString());
    details.put("company_commission_pct", config.getCompanyCommissionPct().toPlainString());
    details.put("attempts_phase1", config.getAttemptsPhase1());
    details.put("max_solitary_months", config.getMaxSolitaryMonths());
    return details;
  }
}
