package dev.pekelund.billsplit.settlement;

/**
 * Thrown when a line item is assigned to somebody who is not in the session's roster.
 *
 * <p>Stored sessions from older clients may carry such lines, for example after a
 * participant was removed from the roster. Those sessions were previously settled with the
 * line's cost silently left out of every share; they are now rejected with
 * {@link Reason#UNKNOWN_PARTICIPANT}. Reassign or drop the line before settling.</p>
 */
public class UnknownParticipantException extends BillSplitException {

    private final String participant;
    private final String itemName;

    public UnknownParticipantException(String participant, String itemName) {
        super(Reason.UNKNOWN_PARTICIPANT,
            "Item '" + itemName + "' is assigned to '" + participant + "' who is not a participant of the session");
        this.participant = participant;
        this.itemName = itemName;
    }

    public String getParticipant() {
        return participant;
    }

    public String getItemName() {
        return itemName;
    }
}
