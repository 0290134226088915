package dev.pekelund.billsplit.settlement;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Distributes each line total across the people sharing it.
 */
class ShareAllocator {

    static final int WORK_SCALE = 10;

    /**
     * @return raw share per participant in roster order, every participant present
     */
    Map<String, BigDecimal> allocate(SplitSession session) {
        Map<String, BigDecimal> totals = new LinkedHashMap<>();
        for (String participant : session.participants()) {
            totals.put(participant, BigDecimal.ZERO);
        }

        int rosterSize = session.participants().size();
        for (LineItem item : session.items()) {
            ItemAssignment assignment = item.assignment();
            int shareCount = assignment.shareCount(rosterSize);
            if (shareCount == 0) {
                continue;
            }

            // quantity is already part of the line total
            BigDecimal share = item.amount().divide(BigDecimal.valueOf(shareCount), WORK_SCALE, RoundingMode.HALF_EVEN);
            Collection<String> sharers = assignment.kind() == ItemAssignment.Kind.EVERYONE
                ? session.participants()
                : assignment.participants();
            for (String sharer : sharers) {
                totals.merge(sharer, share, BigDecimal::add);
            }
        }
        return totals;
    }
}
