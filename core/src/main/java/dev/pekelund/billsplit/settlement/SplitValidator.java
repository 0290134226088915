package dev.pekelund.billsplit.settlement;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Structural preconditions of a session and the variance check between allocated and
 * entered totals.
 */
class SplitValidator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int VARIANCE_SCALE = 4;

    private final SettlementPolicy policy;

    SplitValidator(SettlementPolicy policy) {
        this.policy = policy;
    }

    /**
     * Checks the session before anything is allocated. Fatal problems are thrown; the
     * returned verdict carries the warnings and whether there is anything to split.
     */
    Verdict checkPreconditions(SplitSession session) {
        if (session.participants().isEmpty()) {
            throw BillSplitException.noParticipants();
        }
        if (session.items().isEmpty()) {
            throw BillSplitException.noItems();
        }
        if (!session.hasParticipant(session.payer())) {
            throw new InvalidPayerException(session.payer());
        }
        for (LineItem item : session.items()) {
            for (String assignee : item.assignment().participants()) {
                if (!session.hasParticipant(assignee)) {
                    throw new UnknownParticipantException(assignee, item.name());
                }
            }
        }

        List<SettlementWarning> warnings = new ArrayList<>();
        long unassigned = session.unassignedItemCount();
        if (unassigned > 0) {
            warnings.add(SettlementWarning.unassignedItems(unassigned));
        }
        if (session.participants().size() == 1) {
            warnings.add(SettlementWarning.singleParticipant());
            return new Verdict(warnings, false);
        }
        return new Verdict(warnings, true);
    }

    /**
     * Compares the sum of all allocations with the entered total.
     *
     * @throws TotalsMismatchException when the variance exceeds the fatal threshold
     */
    Optional<SettlementWarning> checkTotals(BigDecimal allocated, BigDecimal expected) {
        BigDecimal difference = allocated.subtract(expected).abs();
        if (expected.signum() == 0) {
            if (difference.signum() == 0) {
                return Optional.empty();
            }
            throw new TotalsMismatchException(allocated, expected, HUNDRED);
        }

        BigDecimal scaledDifference = difference.multiply(HUNDRED);
        BigDecimal variancePercent = scaledDifference.divide(expected, VARIANCE_SCALE, RoundingMode.HALF_UP);
        if (scaledDifference.compareTo(policy.fatalVariancePercent().multiply(expected)) > 0) {
            throw new TotalsMismatchException(allocated, expected, variancePercent);
        }
        if (scaledDifference.compareTo(policy.warningVariancePercent().multiply(expected)) > 0) {
            return Optional.of(SettlementWarning.totalVariance(allocated, expected, variancePercent));
        }
        return Optional.empty();
    }

    record Verdict(List<SettlementWarning> warnings, boolean proceed) {

        Verdict {
            warnings = List.copyOf(warnings);
        }
    }
}
