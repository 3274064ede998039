package com.harvestlink.provenance.offchain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Off-chain store tests against PostgreSQL.
 *
 * These tests verify that:
 * - Registration creates a crop and a batch with a pending QR code
 * - QR codes are issued once and looked up exactly
 * - Anchors start unverified and are confirmed per transaction
 * - Purchases reduce the remaining quantity and close out the batch
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class JpaOffChainDataStoreTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("provenance_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // No broker in these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("provenance.kafka.relay.enabled", () -> "false");
    }

    @Autowired
    private OffChainDataStore store;

    private static String batchNumber() {
        return "BATCH-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static CropRegistration registration() {
        return CropRegistration.builder()
                .name("Basmati Rice")
                .description("Aged one year")
                .quantity(new BigDecimal("500"))
                .pricePerUnit(new BigDecimal("95.25"))
                .harvestDate(LocalDate.of(2024, 1, 15))
                .location("Karnal")
                .certifications(List.of("Organic", "FSSAI"))
                .farmerName("Harpreet Singh")
                .build();
    }

    @Test
    @DisplayName("Registration stores crop and batch with a pending QR code")
    void registerCrop() {
        String number = batchNumber();

        OffChainBatch batch = store.registerCrop(registration(), number);

        assertEquals(number, batch.getBatchNumber());
        assertEquals(OffChainBatch.PENDING_QR_CODE, batch.getQrCode());
        assertFalse(batch.hasIssuedQrCode());
        assertEquals("kg", batch.getUnit());
        assertEquals(0, new BigDecimal("500").compareTo(batch.getQuantity()));
        assertEquals(OffChainBatch.STATUS_AVAILABLE, batch.getStatus());
        assertEquals(List.of("Organic", "FSSAI"), batch.getCrop().getCertifications());

        OffChainBatch reloaded = store.findBatchById(batch.getId()).orElseThrow();
        assertEquals(number, reloaded.getBatchNumber());
        assertEquals("Karnal", reloaded.getCrop().getLocation());
        assertEquals(LocalDate.of(2024, 1, 15), reloaded.getCrop().getHarvestDate());
    }

    @Test
    @DisplayName("Duplicate batch numbers and invalid registrations are rejected")
    void registrationRules() {
        String number = batchNumber();
        store.registerCrop(registration(), number);

        assertThrows(IllegalStateException.class, () -> store.registerCrop(registration(), number));
        assertThrows(IllegalArgumentException.class, () -> store.registerCrop(
                CropRegistration.builder().name("Wheat").quantity(BigDecimal.ONE)
                        .pricePerUnit(BigDecimal.ONE).build(), batchNumber()));
    }

    @Test
    @DisplayName("QR code is issued once and found by exact match")
    void assignQrCode() {
        OffChainBatch batch = store.registerCrop(registration(), batchNumber());
        String url = "https://trace.example.org/b/" + batch.getId() + "/" + UUID.randomUUID();

        store.assignQrCode(batch.getId(), url);

        assertEquals(batch.getId(), store.findBatchByQrCode(url).orElseThrow().getId());
        assertTrue(store.findBatchByQrCode(url + "x").isEmpty());
        assertTrue(store.findBatchByQrCode(OffChainBatch.PENDING_QR_CODE).isEmpty());
        assertThrows(IllegalStateException.class, () -> store.assignQrCode(batch.getId(), url + "2"));
    }

    @Test
    @DisplayName("Anchors start unverified and are confirmed by transaction hash")
    void anchors() {
        OffChainBatch batch = store.registerCrop(registration(), batchNumber());
        String tx = "0x" + "ab".repeat(32);

        AnchoringRecord anchor = store.saveAnchoringRecord(batch.getId(), tx, 17, "f".repeat(64));
        assertFalse(anchor.isVerified());

        assertEquals(1, store.confirmAnchors(tx.toUpperCase().replace("0X", "0x")));
        assertEquals(0, store.confirmAnchors(tx));

        List<AnchoringRecord> records = store.findAnchoringRecords(batch.getId());
        assertEquals(1, records.size());
        assertTrue(records.get(0).isVerified());
        assertEquals(17, records.get(0).getBlockNumber());
        assertEquals(1, store.findAnchoringRecordsByTransaction(tx).size());
    }

    @Test
    @DisplayName("Writes against a missing batch fail")
    void missingBatch() {
        assertThrows(IllegalArgumentException.class,
                () -> store.saveAnchoringRecord(Long.MAX_VALUE, "0x1", 1, "hash"));
        assertThrows(IllegalArgumentException.class,
                () -> store.linkLedgerBatch(Long.MAX_VALUE, 1));
        assertTrue(store.findBatchById(Long.MAX_VALUE).isEmpty());
    }

    @Test
    @DisplayName("Purchases reduce quantity and the last one marks the batch purchased")
    void purchases() {
        OffChainBatch batch = store.registerCrop(registration(), batchNumber());

        SupplyTransaction first = store.recordPurchase(batch.getId(), "FreshMart", new BigDecimal("200"), null);
        assertEquals("Harpreet Singh", first.getSeller());
        assertEquals(0, new BigDecimal("19050").compareTo(first.getTotalPrice()));

        store.recordPurchase(batch.getId(), "GreenGrocer", new BigDecimal("300"), "0x" + "cd".repeat(32));

        OffChainBatch after = store.findBatchById(batch.getId()).orElseThrow();
        assertEquals(0, BigDecimal.ZERO.compareTo(after.getQuantity()));
        assertEquals(OffChainBatch.STATUS_PURCHASED, after.getStatus());
        assertEquals(2, store.findSupplyTransactions(batch.getId()).size());
        assertEquals("FreshMart", store.findSupplyTransactions(batch.getId()).get(0).getBuyer());
        assertThrows(IllegalStateException.class,
                () -> store.recordPurchase(batch.getId(), "Late", BigDecimal.ONE, null));
    }

    @Test
    @DisplayName("Buying more than remains is rejected")
    void overPurchase() {
        OffChainBatch batch = store.registerCrop(registration(), batchNumber());

        assertThrows(IllegalStateException.class,
                () -> store.recordPurchase(batch.getId(), "FreshMart", new BigDecimal("500.01"), null));
    }
}
