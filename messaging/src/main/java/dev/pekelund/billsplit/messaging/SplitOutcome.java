package dev.pekelund.billsplit.messaging;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reply to a split request: exactly one of {@code result} and {@code failure} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SplitOutcome(
    @JsonProperty("result") SplitResultMessage result,
    @JsonProperty("failure") SplitFailureMessage failure
) {

    public SplitOutcome {
        if ((result == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of result and failure must be set");
        }
    }

    public static SplitOutcome success(SplitResultMessage result) {
        return new SplitOutcome(result, null);
    }

    public static SplitOutcome failure(SplitFailureMessage failure) {
        return new SplitOutcome(null, failure);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return result != null;
    }
}
