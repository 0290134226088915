package dev.pekelund.billsplit.messaging;

/**
 * Signals a split request that cannot be turned into a session, such as a missing total
 * or a malformed line.
 */
public class SplitMessageException extends RuntimeException {

    public SplitMessageException(String message) {
        super(message);
    }

    public SplitMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
