package com.harvestlink.provenance.ledger.exception;

import java.time.Duration;

/**
 * A submitted transaction was not included within the configured bound.
 */
public class TransactionTimeoutException extends LedgerException {

    public TransactionTimeoutException(String functionName, Duration bound) {
        super(String.format("Transaction %s not included within %d ms", functionName, bound.toMillis()));
    }
}
