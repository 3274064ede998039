package com.harvestlink.provenance.ledger.exception;

/**
 * The wallet holder declined a connection or signing request.
 */
public class UserRejectedException extends LedgerException {

    public UserRejectedException(String message) {
        super(message);
    }
}
