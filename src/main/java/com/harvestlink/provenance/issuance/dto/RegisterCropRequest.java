package com.harvestlink.provenance.issuance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.harvestlink.provenance.offchain.CropRegistration;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Request DTO for listing a crop off-chain.
 */
@Value
public class RegisterCropRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @NotNull(message = "Quantity is required")
    @DecimalMin(value = "0", inclusive = false, message = "Quantity must be greater than 0")
    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("unit")
    String unit;

    @NotNull(message = "Price per unit is required")
    @DecimalMin(value = "0", message = "Price per unit must not be negative")
    @JsonProperty("price_per_unit")
    BigDecimal pricePerUnit;

    @JsonProperty("harvest_date")
    LocalDate harvestDate;

    @JsonProperty("location")
    String location;

    @JsonProperty("certifications")
    List<String> certifications;

    @NotBlank(message = "Farmer name is required")
    @JsonProperty("farmer_name")
    String farmerName;

    public CropRegistration toRegistration() {
        return CropRegistration.builder()
                .name(name)
                .description(description)
                .quantity(quantity)
                .unit(unit)
                .pricePerUnit(pricePerUnit)
                .harvestDate(harvestDate)
                .location(location)
                .certifications(certifications == null ? List.of() : List.copyOf(certifications))
                .farmerName(farmerName)
                .build();
    }
}
