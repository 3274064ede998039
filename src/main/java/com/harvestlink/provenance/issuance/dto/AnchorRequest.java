package com.harvestlink.provenance.issuance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

@Value
public class AnchorRequest {

    @NotBlank(message = "Transaction hash is required")
    @Pattern(regexp = "^0x[0-9a-fA-F]{64}$", message = "Transaction hash must be 0x followed by 64 hex digits")
    @JsonProperty("transaction_hash")
    String transactionHash;

    @NotNull(message = "Block number is required")
    @PositiveOrZero(message = "Block number must not be negative")
    @JsonProperty("block_number")
    Long blockNumber;
}
