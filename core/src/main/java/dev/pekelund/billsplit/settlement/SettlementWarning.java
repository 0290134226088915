package dev.pekelund.billsplit.settlement;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Non-fatal condition detected while computing settlements. Only the fields belonging to
 * the warning's {@link Type} are populated.
 */
public record SettlementWarning(
    Type type,
    BigDecimal allocated,
    BigDecimal expected,
    BigDecimal variancePercent,
    long count
) {

    public enum Type {

        /**
         * The sum of all allocations diverges from the entered total beyond the warning threshold.
         */
        TOTAL_VARIANCE,

        /**
         * Some items are not assigned to anybody and contribute nothing to any share.
         */
        UNASSIGNED_ITEMS,

        /**
         * Only one participant; nothing to settle.
         */
        SINGLE_PARTICIPANT
    }

    public SettlementWarning {
        Objects.requireNonNull(type, "type must not be null");
    }

    public static SettlementWarning totalVariance(BigDecimal allocated, BigDecimal expected,
        BigDecimal variancePercent) {
        return new SettlementWarning(Type.TOTAL_VARIANCE, allocated, expected, variancePercent, 0);
    }

    public static SettlementWarning unassignedItems(long count) {
        return new SettlementWarning(Type.UNASSIGNED_ITEMS, null, null, null, count);
    }

    public static SettlementWarning singleParticipant() {
        return new SettlementWarning(Type.SINGLE_PARTICIPANT, null, null, null, 0);
    }

    public String message() {
        return switch (type) {
            case TOTAL_VARIANCE -> String.format("Total mismatch: calculated %s vs entered %s (variance %s%%). "
                    + "Please verify manually.", twoDecimals(allocated), twoDecimals(expected),
                twoDecimals(variancePercent));
            case UNASSIGNED_ITEMS -> count + " item(s) not assigned to any participant";
            case SINGLE_PARTICIPANT -> "Only one participant - no splits necessary";
        };
    }

    private static String twoDecimals(BigDecimal value) {
        return value == null ? "?" : value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
