package com.harvestlink.provenance.issuance;

import com.harvestlink.provenance.identifier.IssuedIdentifier;
import com.harvestlink.provenance.offchain.OffChainBatch;
import lombok.Value;

/**
 * A newly listed crop: its off-chain batch and the identifier printed on it.
 */
@Value
public class RegisteredCrop {
    OffChainBatch batch;
    IssuedIdentifier identifier;
}
