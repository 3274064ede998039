package com.harvestlink.provenance.offchain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Farmer-supplied crop details for a new off-chain listing.
 */
@Value
@Builder
public class CropRegistration {
    String name;
    String description;
    BigDecimal quantity;
    String unit;
    BigDecimal pricePerUnit;
    LocalDate harvestDate;
    String location;
    @Builder.Default
    List<String> certifications = List.of();
    String farmerName;

    /**
     * @throws IllegalArgumentException if a required field is missing or negative
     */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Crop name is required");
        }
        if (farmerName == null || farmerName.isBlank()) {
            throw new IllegalArgumentException("Farmer name is required");
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        if (pricePerUnit == null || pricePerUnit.signum() < 0) {
            throw new IllegalArgumentException("Price per unit must be non-negative");
        }
    }

    public String unitOrDefault() {
        return unit == null || unit.isBlank() ? "kg" : unit;
    }
}
