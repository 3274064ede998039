package com.harvestlink.provenance.verification;

/**
 * Outcome of checking one anchoring record.
 *
 * @param observedOnLedger the record was already confirmed, or its transaction is in the mirrored history
 * @param dataIntact the anchored hash equals the hash of the current off-chain snapshot
 */
public record AnchorCheck(
        String transactionHash,
        long blockNumber,
        String anchoredHash,
        boolean observedOnLedger,
        boolean dataIntact) {

    public boolean passed() {
        return observedOnLedger && dataIntact;
    }
}
