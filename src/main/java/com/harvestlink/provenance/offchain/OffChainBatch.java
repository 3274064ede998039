package com.harvestlink.provenance.offchain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * A batch row of the off-chain store together with its crop.
 */
@Value
@Builder(toBuilder = true)
public class OffChainBatch {

    public static final String PENDING_QR_CODE = "PENDING";
    public static final String STATUS_AVAILABLE = "available";
    public static final String STATUS_PURCHASED = "purchased";

    long id;
    String batchNumber;
    CropDetails crop;
    Long ledgerBatchId;
    String qrCode;
    BigDecimal quantity;
    String unit;
    BigDecimal pricePerUnit;
    String status;
    Instant createdAt;

    public boolean hasIssuedQrCode() {
        return qrCode != null && !PENDING_QR_CODE.equals(qrCode);
    }

    @Value
    @Builder
    public static class CropDetails {
        long id;
        String name;
        String description;
        BigDecimal quantity;
        String unit;
        BigDecimal pricePerUnit;
        LocalDate harvestDate;
        String location;
        List<String> certifications;
        String farmerName;
        String status;
        Instant createdAt;
    }
}
