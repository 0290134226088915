package dev.pekelund.billsplit.settlement;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a successful settlement computation.
 *
 * @param settlements payments owed to the payer, largest first
 * @param warnings    non-fatal conditions detected on the way
 * @param shares      reconciled share of the bill per participant in roster order; sums to the
 *                    entered total exactly, empty when nothing had to be split
 */
public record SplitResult(
    List<Settlement> settlements,
    List<SettlementWarning> warnings,
    Map<String, BigDecimal> shares
) {

    public SplitResult {
        settlements = settlements == null ? List.of() : List.copyOf(settlements);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        shares = shares == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(shares));
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public boolean hasWarning(SettlementWarning.Type type) {
        return warnings.stream().anyMatch(warning -> warning.type() == type);
    }

    public Optional<Settlement> settlementFrom(String participant) {
        return settlements.stream().filter(settlement -> settlement.from().equals(participant)).findFirst();
    }

    public BigDecimal totalSettled() {
        return Amounts.sum(settlements.stream().map(Settlement::amount).toList());
    }

    public BigDecimal shareOf(String participant) {
        return shares.getOrDefault(participant, BigDecimal.ZERO);
    }
}
