package com.harvestlink.provenance.issuance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class CreateLedgerProductRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @JsonProperty("content_hash")
    String contentHash;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0", message = "Price must not be negative")
    @JsonProperty("price")
    BigDecimal price;
}
