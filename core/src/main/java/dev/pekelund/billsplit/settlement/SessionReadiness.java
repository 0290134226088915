package dev.pekelund.billsplit.settlement;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Lists the problems a user should fix before asking for settlements. Unlike
 * {@link BillSplitEngine#computeSplits(SplitSession)} this never throws and reports every
 * problem at once.
 */
public class SessionReadiness {

    static final int MINIMUM_PARTICIPANTS = 2;

    private final SettlementPolicy policy;

    public SessionReadiness(SettlementPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    public List<String> problems(SplitSession session) {
        List<String> problems = new ArrayList<>();

        if (session.participants().isEmpty()) {
            problems.add("No participants added");
        } else if (session.participants().size() < MINIMUM_PARTICIPANTS) {
            problems.add("Need at least " + MINIMUM_PARTICIPANTS + " participants");
        }

        if (!StringUtils.hasText(session.payer())) {
            problems.add("No payer selected");
        } else if (!session.hasParticipant(session.payer())) {
            problems.add("Payer must be a participant");
        }

        if (session.items().isEmpty()) {
            problems.add("No items added");
        } else if (session.items().stream().anyMatch(item -> !StringUtils.hasText(item.name()))) {
            problems.add("Some items have invalid data");
        }

        if (session.enteredTotal().signum() <= 0) {
            problems.add("Total amount must be greater than 0");
        } else if (!session.items().isEmpty() && session.hasTotalDiscrepancy(policy.discrepancyTolerance())) {
            problems.add("Items add up to " + Amounts.format(session.calculatedTotal(), policy.currencySymbol())
                + " but the entered total is " + Amounts.format(session.enteredTotal(), policy.currencySymbol()));
        }

        long unassigned = session.unassignedItemCount();
        if (unassigned > 0) {
            problems.add(unassigned + " item(s) not assigned");
        }
        return problems;
    }

    public boolean isReady(SplitSession session) {
        return problems(session).isEmpty();
    }
}
