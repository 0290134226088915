package dev.pekelund.billsplit.messaging;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

public record SettlementMessage(
    @JsonProperty("from") String from,
    @JsonProperty("to") String to,
    @JsonProperty("amount") BigDecimal amount,
    @JsonProperty("explanation") String explanation
) {
}
