package com.harvestlink.provenance.issuance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Value;

import java.util.List;

@Value
public class CreateLedgerBatchRequest {

    @NotEmpty(message = "At least one product id is required")
    @JsonProperty("product_ids")
    List<Long> productIds;

    @NotBlank(message = "Location is required")
    @JsonProperty("location")
    String location;

    /**
     * Off-chain batch to link and anchor, optional.
     */
    @JsonProperty("offchain_batch_id")
    Long offChainBatchId;
}
