package dev.pekelund.billsplit.settlement;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Thrown when the allocated items diverge from the entered total by more than the fatal
 * variance threshold.
 */
public class TotalsMismatchException extends BillSplitException {

    private final BigDecimal allocated;
    private final BigDecimal expected;
    private final BigDecimal variancePercent;

    public TotalsMismatchException(BigDecimal allocated, BigDecimal expected, BigDecimal variancePercent) {
        super(Reason.TOTALS_DO_NOT_MATCH, String.format(
            "Allocated items total %s but the entered total is %s (variance %s%%)",
            allocated.setScale(2, RoundingMode.HALF_UP).toPlainString(),
            expected.setScale(2, RoundingMode.HALF_UP).toPlainString(),
            variancePercent.setScale(2, RoundingMode.HALF_UP).toPlainString()));
        this.allocated = allocated;
        this.expected = expected;
        this.variancePercent = variancePercent;
    }

    public BigDecimal getAllocated() {
        return allocated;
    }

    public BigDecimal getExpected() {
        return expected;
    }

    public BigDecimal getVariancePercent() {
        return variancePercent;
    }
}
