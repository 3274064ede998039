package com.harvestlink.provenance.verification;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

public record ProductRecord(
        long id,
        String name,
        String description,
        String contentHash,
        String originator,
        String currentHolder,
        BigInteger priceWei,
        BigDecimal displayPrice,
        String displayCurrency,
        Instant createdAt,
        int statusCode,
        String statusName,
        List<String> certificates) implements ProvenanceRecord {
}
