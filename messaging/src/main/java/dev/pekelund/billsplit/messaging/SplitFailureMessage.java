package dev.pekelund.billsplit.messaging;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reply sent instead of a {@link SplitResultMessage} when a session cannot be settled.
 *
 * @param reason one of the engine's rejection reasons or {@link #INVALID_MESSAGE}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SplitFailureMessage(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("reason") String reason,
    @JsonProperty("message") String message
) {

    public static final String INVALID_MESSAGE = "INVALID_MESSAGE";
}
