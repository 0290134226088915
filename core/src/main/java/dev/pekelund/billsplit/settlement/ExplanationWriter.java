package dev.pekelund.billsplit.settlement;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders how a participant's share was derived, one receipt line per row:
 * <pre>
 * Burger: $15.00
 * Beer (×3): $15.00
 * Pizza: $24.00 ÷ 3 = $8.00
 * </pre>
 */
class ExplanationWriter {

    static final String DEFAULT_EXPLANATION = "Your share of the bill";

    private final String currencySymbol;

    ExplanationWriter(String currencySymbol) {
        this.currencySymbol = currencySymbol;
    }

    String explain(String participant, SplitSession session) {
        int rosterSize = session.participants().size();
        List<String> lines = new ArrayList<>();
        for (LineItem item : session.itemsAssignedTo(participant)) {
            int shareCount = item.assignment().shareCount(rosterSize);
            if (shareCount > 0) {
                lines.add(describe(item, shareCount));
            }
        }
        if (lines.isEmpty()) {
            return DEFAULT_EXPLANATION;
        }
        return String.join("\n", lines);
    }

    private String describe(LineItem item, int shareCount) {
        String label = item.quantity() > 1 ? item.name() + " (×" + item.quantity() + ")" : item.name();
        String lineTotal = Amounts.format(item.amount(), currencySymbol);
        if (shareCount == 1) {
            return label + ": " + lineTotal;
        }
        BigDecimal share = item.amount().divide(BigDecimal.valueOf(shareCount), 2, RoundingMode.HALF_UP);
        return label + ": " + lineTotal + " ÷ " + shareCount + " = " + Amounts.format(share, currencySymbol);
    }
}
