package com.harvestlink.provenance.verification;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * A batch as held in the off-chain store, resolved from a public scan identifier.
 */
public record PublicBatchRecord(
        long id,
        String batchNumber,
        String qrCode,
        String status,
        String crop,
        String description,
        BigDecimal quantity,
        String unit,
        BigDecimal pricePerUnit,
        LocalDate harvestDate,
        String location,
        List<String> certifications,
        String farmer,
        Long ledgerBatchId) implements ProvenanceRecord {
}
