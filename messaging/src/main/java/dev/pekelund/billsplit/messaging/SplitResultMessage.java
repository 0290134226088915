package dev.pekelund.billsplit.messaging;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settlements computed for a session, ready to be stored as the session's
 * {@code computed_splits}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SplitResultMessage(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("computed_splits") List<SettlementMessage> computedSplits,
    @JsonProperty("warnings") List<WarningMessage> warnings,
    @JsonProperty("shares") Map<String, BigDecimal> shares
) {

    public SplitResultMessage {
        computedSplits = computedSplits == null ? List.of() : List.copyOf(computedSplits);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        shares = shares == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(shares));
    }
}
