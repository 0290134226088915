package dev.pekelund.billsplit.settlement;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rounds every share to whole cents and hands out the leftover cents so that the shares
 * add up to the entered total exactly.
 *
 * <p>Leftover cents go round-robin over the participants in lexicographic order, one cent
 * each, so the outcome depends only on the input and never on allocation size or map
 * iteration order. Surplus cents are taken back in the same order, skipping participants
 * already at zero, so no share ever goes negative.</p>
 */
class CentReconciler {

    /**
     * @param shares       raw shares per participant, in roster order
     * @param enteredTotal amount the shares must add up to
     * @return shares in cents, same iteration order as {@code shares}
     */
    Map<String, Long> reconcile(Map<String, BigDecimal> shares, BigDecimal enteredTotal) {
        Map<String, Long> cents = new LinkedHashMap<>();
        long baseCents = 0;
        for (Map.Entry<String, BigDecimal> entry : shares.entrySet()) {
            long rounded = Amounts.toCents(entry.getValue());
            cents.put(entry.getKey(), rounded);
            baseCents += rounded;
        }

        long remainder = Amounts.toCents(enteredTotal) - baseCents;
        if (remainder == 0 || cents.isEmpty()) {
            return cents;
        }

        List<String> order = new ArrayList<>(cents.keySet());
        Collections.sort(order);
        if (remainder > 0) {
            for (long i = 0; i < remainder; i++) {
                cents.merge(order.get((int) (i % order.size())), 1L, Long::sum);
            }
            return cents;
        }

        // shares are never negative and the total is not, so some share is still above zero
        int index = 0;
        while (remainder < 0) {
            String participant = order.get(index % order.size());
            if (cents.get(participant) > 0) {
                cents.merge(participant, -1L, Long::sum);
                remainder++;
            }
            index++;
        }
        return cents;
    }
}
