package com.harvestlink.provenance.issuance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.harvestlink.provenance.identifier.IdentifierKind;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

@Value
public class IssueIdentifierRequest {

    @NotNull(message = "Kind is required")
    @JsonProperty("kind")
    IdentifierKind kind;

    @NotNull(message = "Id is required")
    @PositiveOrZero(message = "Id must not be negative")
    @JsonProperty("id")
    Long id;
}
