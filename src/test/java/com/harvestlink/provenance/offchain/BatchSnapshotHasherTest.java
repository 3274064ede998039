package com.harvestlink.provenance.offchain;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchSnapshotHasherTest {

    private final BatchSnapshotHasher hasher = new BatchSnapshotHasher(new ObjectMapper());

    private static OffChainBatch batch() {
        return OffChainBatch.builder()
                .id(11)
                .batchNumber("BATCH-1700000000000-abc1234")
                .qrCode(OffChainBatch.PENDING_QR_CODE)
                .quantity(new BigDecimal("120.000"))
                .unit("kg")
                .pricePerUnit(new BigDecimal("42.50"))
                .status(OffChainBatch.STATUS_AVAILABLE)
                .createdAt(Instant.parse("2024-03-01T00:00:00Z"))
                .crop(OffChainBatch.CropDetails.builder()
                        .id(3)
                        .name("Alphonso Mango")
                        .description("Ratnagiri, hand picked")
                        .quantity(new BigDecimal("120"))
                        .unit("kg")
                        .pricePerUnit(new BigDecimal("42.5"))
                        .harvestDate(LocalDate.of(2024, 2, 27))
                        .location("Ratnagiri")
                        .certifications(List.of("Organic", "GI Tag"))
                        .farmerName("Sunita Patil")
                        .status("available")
                        .build())
                .build();
    }

    @Test
    @DisplayName("Hash is 64 hex chars and stable for the same data")
    void stable() {
        String hash = hasher.hash(batch());

        assertTrue(hash.matches("[0-9a-f]{64}"));
        assertEquals(hash, hasher.hash(batch()));
    }

    @Test
    @DisplayName("Canonical JSON sorts keys and strips trailing zeros")
    void canonicalForm() {
        String json = hasher.canonicalJson(batch());

        assertTrue(json.startsWith("{\"batchId\":11,\"batchNumber\":"), json);
        assertTrue(json.contains("\"pricePerUnit\":\"42.5\""), json);
        assertTrue(json.contains("\"harvestDate\":\"2024-02-27\""), json);
    }

    @Test
    @DisplayName("Quantity sold, status and issued QR code do not change the hash")
    void mutableFieldsExcluded() {
        OffChainBatch sold = batch().toBuilder()
                .quantity(BigDecimal.ZERO)
                .status(OffChainBatch.STATUS_PURCHASED)
                .qrCode("https://trace.example.org/b/11/nonce")
                .build();

        assertEquals(hasher.hash(batch()), hasher.hash(sold));
    }

    @Test
    @DisplayName("Edited registration data changes the hash")
    void tamperDetected() {
        OffChainBatch original = batch();
        OffChainBatch edited = original.toBuilder()
                .crop(OffChainBatch.CropDetails.builder()
                        .id(3)
                        .name("Alphonso Mango")
                        .description("Ratnagiri, hand picked")
                        .quantity(new BigDecimal("120"))
                        .unit("kg")
                        .pricePerUnit(new BigDecimal("42.5"))
                        .harvestDate(LocalDate.of(2024, 2, 27))
                        .location("Devgad")
                        .certifications(List.of("Organic", "GI Tag"))
                        .farmerName("Sunita Patil")
                        .build())
                .build();

        assertNotEquals(hasher.hash(original), hasher.hash(edited));
    }
}
