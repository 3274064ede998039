package com.harvestlink.provenance.offchain;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity for a registered crop.
 *
 * No setters: registration data is fixed once written, only the listing
 * status moves (available, sold).
 */
@Entity
@Table(name = "crops")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CropEntity {

    static final String STATUS_SOLD = "sold";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private String name;

    @Column(updatable = false)
    private String description;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal quantity;

    @Column(nullable = false, updatable = false)
    private String unit;

    @Column(name = "price_per_unit", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal pricePerUnit;

    @Column(name = "harvest_date", updatable = false)
    private LocalDate harvestDate;

    @Column(updatable = false)
    private String location;

    @Column(name = "farmer_name", nullable = false, updatable = false)
    private String farmerName;

    @Column(nullable = false)
    private String status;

    @ElementCollection
    @CollectionTable(name = "crop_certifications", joinColumns = @JoinColumn(name = "crop_id"))
    @OrderColumn(name = "position")
    @Column(name = "certification", nullable = false)
    private List<String> certifications = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static CropEntity fromRegistration(CropRegistration registration) {
        return new CropEntity(
            null,
            registration.getName(),
            registration.getDescription(),
            registration.getQuantity(),
            registration.unitOrDefault(),
            registration.getPricePerUnit(),
            registration.getHarvestDate(),
            registration.getLocation(),
            registration.getFarmerName(),
            OffChainBatch.STATUS_AVAILABLE,
            new ArrayList<>(registration.getCertifications() == null ? List.of() : registration.getCertifications()),
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    OffChainBatch.CropDetails toDetails() {
        return OffChainBatch.CropDetails.builder()
                .id(id)
                .name(name)
                .description(description)
                .quantity(quantity)
                .unit(unit)
                .pricePerUnit(pricePerUnit)
                .harvestDate(harvestDate)
                .location(location)
                .certifications(List.copyOf(certifications))
                .farmerName(farmerName)
                .status(status)
                .createdAt(createdAt)
                .build();
    }

    void markSold() {
        this.status = STATUS_SOLD;
    }
}
