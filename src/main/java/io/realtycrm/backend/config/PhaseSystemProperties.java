package io.realtycrm.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults for the phase system REST surface.
 *
 * @param historyLimit number of history entries returned when the caller gives no limit
 * @param rankingLimit number of advisors returned by the ranking when the caller gives no limit
 * @param defaultLeadSource lead source stored when a contact is marked as pool lead without one
 */
@ConfigurationProperties(prefix = "phase-system")
public record PhaseSystemProperties(
    int historyLimit, int rankingLimit, String defaultLeadSource) {

  public PhaseSystemProperties {
    if (historyLimit <= 0) {
      historyLimit = 50;
    }
    if (rankingLimit <= 0) {
      rankingLimit = 10;
    }
    if (defaultLeadSource == null || defaultLeadSource.isBlank()) {
      defaultLeadSource = "pool_fases";
    }
  }
}
