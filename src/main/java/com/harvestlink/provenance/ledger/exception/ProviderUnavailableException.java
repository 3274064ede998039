package com.harvestlink.provenance.ledger.exception;

/**
 * No wallet provider is present, or the provider failed to answer.
 */
public class ProviderUnavailableException extends LedgerException {

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
