package com.harvestlink.provenance.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class UpdateLocationRequest {

    @NotBlank(message = "Location is required")
    @JsonProperty("location")
    String location;
}
