package com.harvestlink.provenance.verification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.harvestlink.provenance.event.DomainEvent;
import com.harvestlink.provenance.event.DomainEventKind;
import com.harvestlink.provenance.event.EventSynchronizer;
import com.harvestlink.provenance.event.SequenceKey;
import com.harvestlink.provenance.event.payload.BatchCreatedPayload;
import com.harvestlink.provenance.event.payload.BatchPurchasedPayload;
import com.harvestlink.provenance.event.payload.OwnershipTransferredPayload;
import com.harvestlink.provenance.event.payload.ProductCreatedPayload;
import com.harvestlink.provenance.identifier.IdentifierCodec;
import com.harvestlink.provenance.identifier.IdentifierKind;
import com.harvestlink.provenance.identifier.IssuedIdentifier;
import com.harvestlink.provenance.identifier.NonceGenerator;
import com.harvestlink.provenance.ledger.Batch;
import com.harvestlink.provenance.ledger.CurrencyConverter;
import com.harvestlink.provenance.ledger.LedgerClient;
import com.harvestlink.provenance.ledger.Product;
import com.harvestlink.provenance.ledger.ProductWithHistory;
import com.harvestlink.provenance.ledger.exception.LedgerRecordNotFoundException;
import com.harvestlink.provenance.ledger.exception.ProviderUnavailableException;
import com.harvestlink.provenance.lifecycle.LifecycleStatusMapper;
import com.harvestlink.provenance.observability.CorrelationContext;
import com.harvestlink.provenance.observability.ProvenanceMetrics;
import com.harvestlink.provenance.offchain.AnchoringRecord;
import com.harvestlink.provenance.offchain.BatchSnapshotHasher;
import com.harvestlink.provenance.offchain.OffChainBatch;
import com.harvestlink.provenance.offchain.OffChainDataStore;
import com.harvestlink.provenance.offchain.SupplyTransaction;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Verification resolver tests.
 *
 * These tests verify that:
 * - Product and legacy batch identifiers resolve against ledger state
 * - Public batch identifiers resolve off-chain and are valid only with intact, confirmed anchors
 * - Unknown and malformed identifiers produce invalid results, never exceptions
 */
class VerificationResolverTest {

    private static final String FARMER = "0xfarmer";
    private static final String BUYER = "0xbuyer";
    private static final Instant CREATED = Instant.parse("2024-02-01T09:00:00Z");

    private LedgerClient ledgerClient;
    private EventSynchronizer synchronizer;
    private OffChainDataStore store;
    private IdentifierCodec codec;
    private BatchSnapshotHasher hasher;
    private SimpleMeterRegistry registry;
    private VerificationResolver resolver;

    @BeforeEach
    void setUp() {
        ledgerClient = mock(LedgerClient.class);
        synchronizer = mock(EventSynchronizer.class);
        store = mock(OffChainDataStore.class);
        codec = new IdentifierCodec("https://trace.example.org", new NonceGenerator("SHA1PRNG"));
        hasher = new BatchSnapshotHasher(new ObjectMapper());
        registry = new SimpleMeterRegistry();
        resolver = new VerificationResolver(ledgerClient, synchronizer, store, codec, hasher,
                LifecycleStatusMapper.canonical(), new CurrencyConverter(new BigDecimal("200000"), "INR"),
                new ProvenanceMetrics(registry));
    }

    private static DomainEvent event(DomainEventKind kind, long block, int index, String tx,
                                     com.harvestlink.provenance.event.payload.EventPayload payload) {
        return new DomainEvent(kind, new SequenceKey(block, index), tx, CREATED.plusSeconds(block), payload);
    }

    @Nested
    @DisplayName("1. Ledger products")
    class Products {

        private Product product(int statusCode, String holder) {
            return Product.builder()
                    .id(1)
                    .name("Tomatoes")
                    .description("Vine ripened")
                    .contentHash("bafy")
                    .originator(FARMER)
                    .currentHolder(holder)
                    .priceMinorUnits(BigInteger.TEN.pow(16))
                    .createdAt(CREATED)
                    .statusCode(statusCode)
                    .certificates(List.of("Organic"))
                    .build();
        }

        @Test
        @DisplayName("1.1 Known product is valid with status name, display price and ledger source")
        void knownProduct() {
            when(ledgerClient.readProductWithHistory(1)).thenReturn(
                    new ProductWithHistory(product(2, FARMER), List.of(FARMER)));

            VerificationResult result = resolver.verifyProduct(1);

            assertTrue(result.isValid());
            assertEquals(VerificationResult.VERIFIED, result.getMessage());
            assertEquals(SourceOfTruth.LEDGER, result.getSourceOfTruth());
            ProductRecord record = assertInstanceOf(ProductRecord.class, result.getRecord());
            assertEquals("Packed", record.statusName());
            assertEquals(new BigDecimal("2000.00"), record.displayPrice());
            assertEquals("INR", record.displayCurrency());
            assertEquals(1, result.getCustodyChain().size());
            assertEquals(FARMER, result.getCustodyChain().get(0).toHolder());
        }

        @Test
        @DisplayName("1.2 Unknown product is invalid, not an error")
        void unknownProduct() {
            when(ledgerClient.readProductWithHistory(99)).thenThrow(new LedgerRecordNotFoundException("Product", 99));

            VerificationResult result = resolver.verifyProduct(99);

            assertFalse(result.isValid());
            assertEquals(VerificationResult.NOT_FOUND_ON_LEDGER, result.getMessage());
            assertNull(result.getRecord());
            assertTrue(result.getCustodyChain().isEmpty());
        }

        @Test
        @DisplayName("1.3 Status codes beyond the table show as Unknown")
        void unknownStatus() {
            when(ledgerClient.readProductWithHistory(1)).thenReturn(
                    new ProductWithHistory(product(12, FARMER), List.of(FARMER)));

            ProductRecord record = (ProductRecord) resolver.verifyProduct(1).getRecord();

            assertEquals(LifecycleStatusMapper.UNKNOWN, record.statusName());
        }

        @Test
        @DisplayName("1.4 Custody chain takes times and transactions from retained events")
        void custodyFromEvents() {
            when(ledgerClient.readProductWithHistory(1)).thenReturn(
                    new ProductWithHistory(product(7, BUYER), List.of(FARMER, BUYER)));
            when(synchronizer.productHistory(1)).thenReturn(List.of(
                    event(DomainEventKind.OWNERSHIP_TRANSFERRED, 9, 0, "0xsale",
                            new OwnershipTransferredPayload(1, FARMER, BUYER)),
                    event(DomainEventKind.PRODUCT_CREATED, 2, 0, "0xmint",
                            new ProductCreatedPayload(1, "Tomatoes", FARMER, BigInteger.ONE))));

            List<CustodyEntry> chain = resolver.verifyProduct(1).getCustodyChain();

            assertEquals(2, chain.size());
            assertEquals("0xmint", chain.get(0).transactionRef());
            assertEquals(FARMER, chain.get(1).fromHolder());
            assertEquals(BUYER, chain.get(1).toHolder());
            assertEquals("0xsale", chain.get(1).transactionRef());
            assertEquals(CREATED.plusSeconds(9), chain.get(1).occurredAt());
        }

        @Test
        @DisplayName("1.5 Provider outage yields an invalid result carrying the reason")
        void providerDown() {
            when(ledgerClient.readProductWithHistory(anyLong()))
                    .thenThrow(new ProviderUnavailableException("No wallet provider detected"));

            VerificationResult result = resolver.verifyProduct(3);

            assertFalse(result.isValid());
            assertTrue(result.getMessage().contains("No wallet provider"));
        }
    }

    @Nested
    @DisplayName("2. Ledger batches")
    class LedgerBatches {

        @Test
        @DisplayName("2.1 Legacy batch identifier resolves on the ledger with event custody")
        void legacyBatch() {
            when(ledgerClient.readBatch(4)).thenReturn(Batch.builder()
                    .id(4).productIds(Set.of(3L, 1L)).handler(BUYER).location("Mumbai")
                    .createdAt(CREATED).statusCode(7).build());
            when(synchronizer.batchHistory(4)).thenReturn(List.of(
                    event(DomainEventKind.BATCH_PURCHASED, 8, 3, "0xbuy",
                            new BatchPurchasedPayload(4, BUYER, FARMER, BigInteger.TEN.pow(16))),
                    event(DomainEventKind.BATCH_CREATED, 5, 0, "0xmake",
                            new BatchCreatedPayload(4, List.of(1L, 3L), FARMER, "Nashik"))));

            VerificationResult result = resolver.verifyScan("https://old.example.org/verify/batch/4");

            assertTrue(result.isValid());
            BatchRecord record = assertInstanceOf(BatchRecord.class, result.getRecord());
            assertEquals(List.of(1L, 3L), record.productIds());
            assertEquals("Purchased", record.statusName());
            assertEquals(List.of("Created", "Purchased"),
                    result.getCustodyChain().stream().map(CustodyEntry::step).toList());
            assertEquals("2000.00 INR", result.getCustodyChain().get(1).note());
            verifyNoInteractions(store);
        }

        @Test
        @DisplayName("2.2 Unknown ledger batch is invalid")
        void unknownBatch() {
            when(ledgerClient.readBatch(50)).thenThrow(new LedgerRecordNotFoundException("Batch", 50));

            VerificationResult result = resolver.verifyBatch(50);

            assertFalse(result.isValid());
            assertEquals(VerificationResult.NOT_FOUND_ON_LEDGER, result.getMessage());
        }
    }

    @Nested
    @DisplayName("3. Public batch identifiers")
    class PublicBatches {

        private static final String TX = "0x" + "12".repeat(32);

        private IssuedIdentifier issued;
        private OffChainBatch batch;

        @BeforeEach
        void setUpBatch() {
            issued = codec.mint(IdentifierKind.BATCH, 21);
            batch = OffChainBatch.builder()
                    .id(21)
                    .batchNumber("BATCH-1-abc")
                    .qrCode(issued.getUrl())
                    .quantity(new BigDecimal("40"))
                    .unit("kg")
                    .pricePerUnit(new BigDecimal("30"))
                    .status(OffChainBatch.STATUS_AVAILABLE)
                    .crop(OffChainBatch.CropDetails.builder()
                            .id(8).name("Onion").quantity(new BigDecimal("50")).unit("kg")
                            .pricePerUnit(new BigDecimal("30")).harvestDate(LocalDate.of(2024, 1, 2))
                            .location("Lasalgaon").certifications(List.of()).farmerName("Ramesh")
                            .createdAt(CREATED).build())
                    .build();
            when(store.findBatchByQrCode(issued.getUrl())).thenReturn(Optional.of(batch));
        }

        private AnchoringRecord anchor(String dataHash, boolean verified) {
            return new AnchoringRecord(1, 21, TX, 30, dataHash, verified, CREATED);
        }

        @Test
        @DisplayName("3.1 Confirmed anchor with matching hash verifies through the hybrid path")
        void verified() {
            when(store.findAnchoringRecords(21)).thenReturn(List.of(anchor(hasher.hash(batch), true)));
            when(store.findSupplyTransactions(21)).thenReturn(List.of(new SupplyTransaction(
                    1, 21, "FreshMart", "Ramesh", new BigDecimal("10"), new BigDecimal("300.0000"),
                    SupplyTransaction.STATUS_COMPLETED, null, CREATED.plusSeconds(60))));

            VerificationResult result = resolver.verifyScan(issued.getUrl());

            assertTrue(result.isValid(), result.getMessage());
            assertEquals(SourceOfTruth.HYBRID, result.getSourceOfTruth());
            assertEquals(VerificationResult.VERIFIED, result.getMessage());
            PublicBatchRecord record = assertInstanceOf(PublicBatchRecord.class, result.getRecord());
            assertEquals("Onion", record.crop());
            assertEquals(List.of("Crop registration", "Purchase"),
                    result.getCustodyChain().stream().map(CustodyEntry::step).toList());
            assertEquals("10 kg for 300", result.getCustodyChain().get(1).note());
            assertTrue(result.getAnchorChecks().get(0).passed());
            verifyNoInteractions(ledgerClient);
        }

        @Test
        @DisplayName("3.2 Edited off-chain data fails with a hash mismatch")
        void tampered() {
            when(store.findAnchoringRecords(21)).thenReturn(List.of(anchor("0".repeat(64), true)));

            VerificationResult result = resolver.verifyScan(issued.getUrl());

            assertFalse(result.isValid());
            assertEquals(VerificationResult.DATA_HASH_MISMATCH, result.getMessage());
            assertNotNull(result.getRecord());
            assertFalse(result.getAnchorChecks().get(0).dataIntact());
        }

        @Test
        @DisplayName("3.3 Batch without anchors is not verified")
        void noAnchors() {
            VerificationResult result = resolver.verifyScan(issued.getUrl());

            assertFalse(result.isValid());
            assertEquals(VerificationResult.NO_ANCHORING_RECORDS, result.getMessage());
        }

        @Test
        @DisplayName("3.4 Unconfirmed anchor counts once its transaction is in the mirrored history")
        void confirmedThroughHistory() {
            when(store.findAnchoringRecords(21)).thenReturn(List.of(anchor(hasher.hash(batch), false)));

            assertEquals(VerificationResult.ANCHOR_NOT_CONFIRMED, resolver.verifyScan(issued.getUrl()).getMessage());

            when(synchronizer.findByTransactionRef(TX)).thenReturn(Optional.of(event(
                    DomainEventKind.BATCH_CREATED, 30, 0, TX, new BatchCreatedPayload(2, List.of(1L), FARMER, "x"))));

            assertTrue(resolver.verifyScan(issued.getUrl()).isValid());
        }

        @Test
        @DisplayName("3.5 Unknown public batch is invalid and never touches the ledger")
        void unknownPublicBatch() {
            VerificationResult result = resolver.verifyScan("https://trace.example.org/b/999/some-nonce");

            assertFalse(result.isValid());
            assertEquals(VerificationResult.UNKNOWN_IDENTIFIER, result.getMessage());
            assertEquals(SourceOfTruth.HYBRID, result.getSourceOfTruth());
            verifyNoInteractions(ledgerClient);
        }

        @Test
        @DisplayName("3.6 Off-chain store failure becomes an invalid result")
        void storeDown() {
            when(store.findBatchByQrCode(anyString())).thenThrow(new IllegalStateException("connection refused"));

            VerificationResult result = resolver.verifyScan(issued.getUrl());

            assertFalse(result.isValid());
            assertTrue(result.getMessage().contains("connection refused"));
        }
    }

    @Nested
    @DisplayName("4. Scans and context")
    class Scans {

        @Test
        @DisplayName("4.1 Malformed scan is invalid without any lookup")
        void malformed() {
            VerificationResult result = resolver.verifyScan("not a code");

            assertFalse(result.isValid());
            assertEquals(VerificationResult.MALFORMED_IDENTIFIER, result.getMessage());
            verifyNoInteractions(ledgerClient, store);
        }

        @Test
        @DisplayName("4.2 Identifier context is restored after a verification")
        void mdcRestored() {
            when(ledgerClient.readBatch(anyLong())).thenThrow(new LedgerRecordNotFoundException("Batch", 1));
            MDC.put(CorrelationContext.IDENTIFIER_MDC_KEY, "outer");
            try {
                resolver.verifyBatch(1);
                assertEquals("outer", MDC.get(CorrelationContext.IDENTIFIER_MDC_KEY));
            } finally {
                MDC.remove(CorrelationContext.IDENTIFIER_MDC_KEY);
            }

            resolver.verifyBatch(1);
            assertNull(MDC.get(CorrelationContext.IDENTIFIER_MDC_KEY));
        }

        @Test
        @DisplayName("4.3 Outcomes are counted by source and validity")
        void metrics() {
            when(ledgerClient.readBatch(anyLong())).thenThrow(new LedgerRecordNotFoundException("Batch", 1));

            resolver.verifyBatch(1);
            resolver.verifyScan("???");

            assertEquals(1.0, registry.get("provenance.verifications")
                    .tag("source", "ledger").tag("valid", "false").counter().count());
            assertEquals(1.0, registry.get("provenance.verifications")
                    .tag("source", "none").counter().count());
        }
    }
}
