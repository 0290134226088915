package dev.pekelund.billsplit.messaging;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Scanning session handed over for settlement once every receipt line has been reviewed
 * and assigned.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SplitSessionMessage(
    @JsonProperty("id") String id,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("participants") List<String> participants,
    @JsonProperty("total_amount") BigDecimal totalAmount,
    @JsonProperty("paid_by") String paidBy,
    @JsonProperty("items") List<LineItemMessage> items
) {

    public SplitSessionMessage {
        participants = participants == null ? List.of() : List.copyOf(participants);
        items = items == null ? List.of() : List.copyOf(items);
    }
}
