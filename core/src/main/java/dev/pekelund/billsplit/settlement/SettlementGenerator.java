package dev.pekelund.billsplit.settlement;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Turns reconciled shares into payments to the payer. Every participant other than the
 * payer owes their whole share directly to the payer.
 */
class SettlementGenerator {

    private final BigDecimal minimumSettlementAmount;
    private final ExplanationWriter explanationWriter;

    SettlementGenerator(BigDecimal minimumSettlementAmount, ExplanationWriter explanationWriter) {
        this.minimumSettlementAmount = minimumSettlementAmount;
        this.explanationWriter = explanationWriter;
    }

    List<Settlement> generate(SplitSession session, Map<String, Long> shareCents) {
        String payer = session.payer();
        List<Settlement> settlements = new ArrayList<>();
        for (String participant : session.participants()) {
            if (participant.equals(payer)) {
                continue;
            }
            BigDecimal owed = Amounts.fromCents(shareCents.getOrDefault(participant, 0L));
            if (owed.compareTo(minimumSettlementAmount) > 0) {
                settlements.add(new Settlement(participant, payer, owed, explanationWriter.explain(participant, session)));
            }
        }
        // stable sort, ties keep roster order
        settlements.sort(Comparator.comparing(Settlement::amount).reversed());
        return settlements;
    }
}
