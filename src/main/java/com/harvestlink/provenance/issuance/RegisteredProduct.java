package com.harvestlink.provenance.issuance;

import com.harvestlink.provenance.identifier.IssuedIdentifier;
import lombok.Value;

@Value
public class RegisteredProduct {
    long productId;
    String transactionHash;
    long blockNumber;
    IssuedIdentifier identifier;
}
