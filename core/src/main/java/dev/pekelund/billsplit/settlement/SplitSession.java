package dev.pekelund.billsplit.settlement;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Input of a settlement computation: the roster, who paid, the bill total as entered by
 * the user and the finalized receipt lines. Instances are immutable copies of the values
 * they were created with.
 *
 * @param sessionId    optional identifier of the scanning session, used for log correlation
 * @param participants ordered, unique participant identifiers
 * @param payer        identifier of the participant who fronted the bill
 * @param enteredTotal authoritative bill total, independent of the sum of line items
 * @param items        receipt lines
 */
public record SplitSession(
    String sessionId,
    List<String> participants,
    String payer,
    BigDecimal enteredTotal,
    List<LineItem> items
) {

    public SplitSession {
        participants = participants == null ? List.of() : List.copyOf(participants);
        items = items == null ? List.of() : List.copyOf(items);
        Objects.requireNonNull(enteredTotal, "enteredTotal must not be null");
        if (enteredTotal.signum() < 0) {
            throw new IllegalArgumentException("Entered total must not be negative but was " + enteredTotal);
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String participant : participants) {
            if (!seen.add(participant)) {
                throw new IllegalArgumentException("Duplicate participant '" + participant + "'");
            }
        }
    }

    public static SplitSession of(List<String> participants, String payer, BigDecimal enteredTotal,
        List<LineItem> items) {
        return new SplitSession(null, participants, payer, enteredTotal, items);
    }

    /**
     * Sum of all line totals, regardless of assignment.
     */
    public BigDecimal calculatedTotal() {
        return items.stream()
            .map(LineItem::amount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Entered total minus the sum of line totals.
     */
    public BigDecimal totalDiscrepancy() {
        return enteredTotal.subtract(calculatedTotal());
    }

    public boolean hasTotalDiscrepancy(BigDecimal tolerance) {
        return totalDiscrepancy().abs().compareTo(tolerance) > 0;
    }

    public long unassignedItemCount() {
        return items.stream().filter(item -> !item.isAssigned()).count();
    }

    public boolean allItemsAssigned() {
        return unassignedItemCount() == 0;
    }

    public boolean hasParticipant(String participant) {
        return participant != null && participants.contains(participant);
    }

    public List<LineItem> itemsAssignedTo(String participant) {
        if (!hasParticipant(participant)) {
            return List.of();
        }
        return items.stream().filter(item -> item.isAssignedTo(participant)).toList();
    }
}
