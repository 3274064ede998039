package com.harvestlink.provenance.ledger.exception;

/**
 * Base type for failures talking to the ledger.
 *
 * Connect and submit failures reach the caller as these exceptions.
 * Verification catches them and reports an invalid result instead.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
