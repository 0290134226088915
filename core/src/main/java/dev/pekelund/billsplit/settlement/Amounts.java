package dev.pekelund.billsplit.settlement;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Conversions between decimal amounts and whole cents.
 */
final class Amounts {

    private Amounts() {
        // Utility class
    }

    static long toCents(BigDecimal amount) {
        return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    static BigDecimal fromCents(long cents) {
        return BigDecimal.valueOf(cents, 2);
    }

    static BigDecimal sum(Collection<BigDecimal> amounts) {
        return amounts.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    static String format(BigDecimal amount, String currencySymbol) {
        BigDecimal rounded = amount.setScale(2, RoundingMode.HALF_UP);
        String symbol = currencySymbol != null ? currencySymbol : "";
        if (rounded.signum() < 0) {
            return "-" + symbol + rounded.negate().toPlainString();
        }
        return symbol + rounded.toPlainString();
    }
}
