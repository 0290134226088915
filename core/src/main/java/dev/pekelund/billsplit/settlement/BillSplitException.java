package dev.pekelund.billsplit.settlement;

import java.util.Objects;

/**
 * Signals a session that cannot be settled. No partial result is produced.
 */
public class BillSplitException extends RuntimeException {

    public enum Reason {
        NO_PARTICIPANTS,
        NO_ITEMS,
        INVALID_PAYER,
        UNKNOWN_PARTICIPANT,
        TOTALS_DO_NOT_MATCH
    }

    private final Reason reason;

    public BillSplitException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public static BillSplitException noParticipants() {
        return new BillSplitException(Reason.NO_PARTICIPANTS, "No participants added");
    }

    public static BillSplitException noItems() {
        return new BillSplitException(Reason.NO_ITEMS, "No items to split");
    }

    public Reason getReason() {
        return reason;
    }
}
