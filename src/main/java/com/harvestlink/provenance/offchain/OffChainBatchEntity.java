package com.harvestlink.provenance.offchain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for an off-chain batch.
 *
 * The QR code starts as {@value OffChainBatch#PENDING_QR_CODE} and can be
 * issued exactly once. The ledger batch id is likewise set at most once.
 */
@Entity
@Table(name = "batches")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OffChainBatchEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "batch_number", nullable = false, unique = true, updatable = false)
    private String batchNumber;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "crop_id", nullable = false, updatable = false)
    private CropEntity crop;

    @Column(name = "ledger_batch_id")
    private Long ledgerBatchId;

    @Column(name = "qr_code", nullable = false)
    private String qrCode;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal quantity;

    @Column(nullable = false, updatable = false)
    private String unit;

    @Column(name = "price_per_unit", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal pricePerUnit;

    @Column(nullable = false)
    private String status;

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

    static OffChainBatchEntity forCrop(CropEntity crop, String batchNumber) {
        return new OffChainBatchEntity(
            null,
            batchNumber,
            crop,
            null,
            OffChainBatch.PENDING_QR_CODE,
            crop.getQuantity(),
            crop.getUnit(),
            crop.getPricePerUnit(),
            OffChainBatch.STATUS_AVAILABLE,
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public OffChainBatch toDomain() {
        return OffChainBatch.builder()
                .id(id)
                .batchNumber(batchNumber)
                .crop(crop.toDetails())
                .ledgerBatchId(ledgerBatchId)
                .qrCode(qrCode)
                .quantity(quantity)
                .unit(unit)
                .pricePerUnit(pricePerUnit)
                .status(status)
                .createdAt(createdAt)
                .build();
    }

    void assignQrCode(String issued) {
        if (!OffChainBatch.PENDING_QR_CODE.equals(this.qrCode)) {
            throw new IllegalStateException("Batch " + id + " already has an issued identifier");
        }
        this.qrCode = issued;
    }

    void linkLedgerBatch(long ledgerId) {
        if (this.ledgerBatchId != null && this.ledgerBatchId != ledgerId) {
            throw new IllegalStateException(
                "Batch " + id + " is already linked to ledger batch " + this.ledgerBatchId);
        }
        this.ledgerBatchId = ledgerId;
    }

    /**
     * Takes the purchased quantity off the batch.
     *
     * @return true if nothing remains afterwards
     */
    boolean reduceQuantity(BigDecimal purchased) {
        if (!OffChainBatch.STATUS_AVAILABLE.equals(status)) {
            throw new IllegalStateException("Batch " + id + " is not available for purchase");
        }
        if (purchased.compareTo(quantity) > 0) {
            throw new IllegalStateException("Requested quantity exceeds available quantity");
        }
        this.quantity = quantity.subtract(purchased);
        if (quantity.signum() == 0) {
            this.status = OffChainBatch.STATUS_PURCHASED;
            return true;
        }
        return false;
    }
}
