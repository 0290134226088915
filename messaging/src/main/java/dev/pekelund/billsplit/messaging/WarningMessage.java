package dev.pekelund.billsplit.messaging;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

/**
 * Non-fatal warning attached to a computed split. Only the fields of the warning's type
 * are present.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WarningMessage(
    @JsonProperty("type") String type,
    @JsonProperty("message") String message,
    @JsonProperty("allocated") BigDecimal allocated,
    @JsonProperty("expected") BigDecimal expected,
    @JsonProperty("variance_percent") BigDecimal variancePercent,
    @JsonProperty("count") Long count
) {
}
