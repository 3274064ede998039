package com.harvestlink.provenance.offchain;

import lombok.Value;

import java.time.Instant;

/**
 * Link between an off-chain batch snapshot and the ledger transaction that
 * anchored it. Unverified until that transaction is observed on the ledger.
 */
@Value
public class AnchoringRecord {
    long id;
    long batchId;
    String transactionHash;
    long blockNumber;
    String dataHash;
    boolean verified;
    Instant recordedAt;
}
