package com.harvestlink.provenance.ledger.exception;

public class NoAccountsException extends LedgerException {

    public NoAccountsException() {
        super("No accounts returned by the wallet provider. Ensure an account is unlocked.");
    }
}
