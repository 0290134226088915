package dev.pekelund.billsplit.settlement;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A directed payment obligation from a debtor to the payer of the bill.
 *
 * @param from        debtor
 * @param to          creditor, always the payer
 * @param amount      amount to transfer, two decimals
 * @param explanation line-by-line derivation of {@code amount}, one receipt line per row
 */
public record Settlement(String from, String to, BigDecimal amount, String explanation) {

    public Settlement {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(amount, "amount must not be null");
        explanation = explanation != null ? explanation : "";
    }

    /**
     * One-line description such as {@code Bob → Alice: $10.00}.
     */
    public String summary(String currencySymbol) {
        return from + " → " + to + ": " + Amounts.format(amount, currencySymbol);
    }
}
