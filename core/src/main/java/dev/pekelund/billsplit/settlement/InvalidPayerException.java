package dev.pekelund.billsplit.settlement;

/**
 * Thrown when the payer of a session is not part of its roster.
 */
public class InvalidPayerException extends BillSplitException {

    private final String payer;

    public InvalidPayerException(String payer) {
        super(Reason.INVALID_PAYER, "Payer '" + payer + "' is not a participant of the session");
        this.payer = payer;
    }

    public String getPayer() {
        return payer;
    }
}
