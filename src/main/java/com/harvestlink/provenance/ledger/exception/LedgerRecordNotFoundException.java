package com.harvestlink.provenance.ledger.exception;

/**
 * A product or batch id that was never created on the ledger.
 */
public class LedgerRecordNotFoundException extends LedgerException {

    public LedgerRecordNotFoundException(String recordType, long id) {
        super(recordType + " not found on ledger: " + id);
    }
}
