package com.harvestlink.provenance.issuance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request DTO for buying from an off-chain batch.
 */
@Value
public class PurchaseRequest {

    @NotBlank(message = "Buyer is required")
    @JsonProperty("buyer")
    String buyer;

    @NotNull(message = "Quantity is required")
    @DecimalMin(value = "0", inclusive = false, message = "Quantity must be greater than 0")
    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("transaction_hash")
    String transactionHash;
}
