package dev.pekelund.billsplit.messaging;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.util.List;

/**
 * Receipt line as stored with a scanning session. {@code price} is the line total, not the
 * unit price.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LineItemMessage(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("quantity") Integer quantity,
    @JsonProperty("price") BigDecimal price,
    @JsonProperty("assigned_to") List<String> assignedTo
) {

    public LineItemMessage {
        assignedTo = assignedTo == null ? List.of() : List.copyOf(assignedTo);
    }
}
