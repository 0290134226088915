package dev.pekelund.billsplit.settlement;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Tunable thresholds of the settlement engine.
 *
 * @param warningVariancePercent  variance (in percent of the entered total) above which a
 *                                {@link SettlementWarning.Type#TOTAL_VARIANCE} warning is raised
 * @param fatalVariancePercent    variance above which the computation is rejected
 * @param minimumSettlementAmount settlements must be strictly greater than this amount
 * @param discrepancyTolerance    allowed gap between item sum and entered total before a session
 *                                is reported as not ready
 * @param currencySymbol          prefix used when rendering amounts in explanations
 */
public record SettlementPolicy(
    BigDecimal warningVariancePercent,
    BigDecimal fatalVariancePercent,
    BigDecimal minimumSettlementAmount,
    BigDecimal discrepancyTolerance,
    String currencySymbol
) {

    public static final BigDecimal DEFAULT_WARNING_VARIANCE_PERCENT = new BigDecimal("1.0");
    public static final BigDecimal DEFAULT_FATAL_VARIANCE_PERCENT = new BigDecimal("10.0");
    public static final BigDecimal DEFAULT_MINIMUM_SETTLEMENT_AMOUNT = new BigDecimal("0.01");
    public static final BigDecimal DEFAULT_DISCREPANCY_TOLERANCE = new BigDecimal("0.05");
    public static final String DEFAULT_CURRENCY_SYMBOL = "$";

    public SettlementPolicy {
        requireNonNegative(warningVariancePercent, "warningVariancePercent");
        requireNonNegative(fatalVariancePercent, "fatalVariancePercent");
        requireNonNegative(minimumSettlementAmount, "minimumSettlementAmount");
        requireNonNegative(discrepancyTolerance, "discrepancyTolerance");
        if (warningVariancePercent.compareTo(fatalVariancePercent) > 0) {
            throw new IllegalArgumentException(String.format(
                "Warning variance threshold %s%% must not exceed fatal variance threshold %s%%",
                warningVariancePercent, fatalVariancePercent));
        }
        currencySymbol = currencySymbol != null ? currencySymbol : DEFAULT_CURRENCY_SYMBOL;
    }

    public static SettlementPolicy defaults() {
        return new SettlementPolicy(DEFAULT_WARNING_VARIANCE_PERCENT, DEFAULT_FATAL_VARIANCE_PERCENT,
            DEFAULT_MINIMUM_SETTLEMENT_AMOUNT, DEFAULT_DISCREPANCY_TOLERANCE, DEFAULT_CURRENCY_SYMBOL);
    }

    private static void requireNonNegative(BigDecimal value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException(name + " must not be negative but was " + value);
        }
    }
}
