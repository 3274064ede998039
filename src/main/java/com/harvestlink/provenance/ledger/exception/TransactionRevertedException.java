package com.harvestlink.provenance.ledger.exception;

/**
 * The contract rejected a transaction.
 */
public class TransactionRevertedException extends LedgerException {

    private final String reason;

    public TransactionRevertedException(String reason) {
        super("Transaction reverted: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
