package dev.pekelund.billsplit.settlement;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Net position of every participant once all settlements are paid. The payer is owed the
 * entered total minus their own share; everybody else owes their share.
 *
 * @param payer    participant who fronted the bill
 * @param balances positive when others owe the participant, negative when the participant owes
 */
public record BalanceSheet(String payer, Map<String, BigDecimal> balances) {

    public BalanceSheet {
        Objects.requireNonNull(payer, "payer must not be null");
        balances = balances == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(balances));
    }

    public static BalanceSheet of(SplitSession session, SplitResult result) {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(result, "result must not be null");

        Map<String, BigDecimal> balances = new LinkedHashMap<>();
        for (Map.Entry<String, BigDecimal> entry : result.shares().entrySet()) {
            BigDecimal share = entry.getValue();
            if (entry.getKey().equals(session.payer())) {
                balances.put(entry.getKey(), session.enteredTotal().subtract(share));
            } else {
                balances.put(entry.getKey(), share.negate());
            }
        }
        return new BalanceSheet(session.payer(), balances);
    }

    public BigDecimal balanceOf(String participant) {
        return balances.getOrDefault(participant, BigDecimal.ZERO);
    }

    public BigDecimal balanceSum() {
        return Amounts.sum(balances.values());
    }

    public boolean isBalanced() {
        return balanceSum().signum() == 0;
    }
}
