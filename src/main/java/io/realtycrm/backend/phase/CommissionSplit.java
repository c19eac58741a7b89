package io.realtycrm.backend.phase;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Division of a pool-lead sale commission between advisor and company. The company share is the
 * remainder, so both shares always add up to {@code amount}.
 */
public record CommissionSplit(
    BigDecimal amount,
    BigDecimal advisorPct,
    BigDecimal companyPct,
    BigDecimal advisorAmount,
    BigDecimal companyAmount) {

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  public static CommissionSplit of(BigDecimal amount, PhaseConfig config) {
    BigDecimal advisorAmount =
        amount
            .multiply(config.getAdvisorCommissionPct())
            .divide(HUNDRED, 2, RoundingMode.HALF_UP);
    BigDecimal companyAmount = amount.setScale(2, RoundingMode.HALF_UP).subtract(advisorAmount);
    return new CommissionSplit(
        amount,
        config.getAdvisorCommissionPct(),
        config.getCompanyCommissionPct(),
        advisorAmount,
        companyAmount);
  }
}
