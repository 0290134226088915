package dev.pekelund.billsplit.settlement;

/**
 * Converts a finalized receipt session into the payments that settle it.
 */
public interface BillSplitEngine {

    /**
     * Computes who owes whom.
     *
     * @param session the session to settle; never modified
     * @return settlements plus any non-fatal warnings
     * @throws BillSplitException when the session cannot be settled
     */
    SplitResult computeSplits(SplitSession session);
}
