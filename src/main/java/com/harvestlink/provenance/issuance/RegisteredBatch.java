package com.harvestlink.provenance.issuance;

import com.harvestlink.provenance.offchain.AnchoringRecord;
import lombok.Value;

/**
 * A batch created on the ledger. The verification URL uses the ledger batch
 * form, since nonce-bearing batch codes name off-chain batches. The anchor is
 * present only when the ledger batch was linked to an off-chain batch.
 */
@Value
public class RegisteredBatch {
    long batchId;
    String transactionHash;
    long blockNumber;
    String verificationUrl;
    AnchoringRecord anchor;
}
