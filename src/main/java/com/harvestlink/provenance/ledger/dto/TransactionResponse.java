package com.harvestlink.provenance.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.harvestlink.provenance.ledger.TransactionRef;
import lombok.Value;

@Value
public class TransactionResponse {

    @JsonProperty("transaction_hash")
    String transactionHash;

    @JsonProperty("block_number")
    long blockNumber;

    public static TransactionResponse from(TransactionRef ref) {
        return new TransactionResponse(ref.getHash(), ref.getBlockNumber());
    }
}
