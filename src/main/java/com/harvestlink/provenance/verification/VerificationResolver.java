package com.harvestlink.provenance.verification;

import com.harvestlink.provenance.event.DomainEvent;
import com.harvestlink.provenance.event.DomainEventKind;
import com.harvestlink.provenance.event.EventSynchronizer;
import com.harvestlink.provenance.event.payload.BatchCreatedPayload;
import com.harvestlink.provenance.event.payload.BatchLocationUpdatedPayload;
import com.harvestlink.provenance.event.payload.BatchPurchasedPayload;
import com.harvestlink.provenance.event.payload.OwnershipTransferredPayload;
import com.harvestlink.provenance.identifier.Identifier;
import com.harvestlink.provenance.identifier.IdentifierCodec;
import com.harvestlink.provenance.identifier.IdentifierKind;
import com.harvestlink.provenance.identifier.ParsedIdentifier;
import com.harvestlink.provenance.ledger.Batch;
import com.harvestlink.provenance.ledger.CurrencyConverter;
import com.harvestlink.provenance.ledger.LedgerClient;
import com.harvestlink.provenance.ledger.Product;
import com.harvestlink.provenance.ledger.ProductWithHistory;
import com.harvestlink.provenance.ledger.exception.LedgerException;
import com.harvestlink.provenance.ledger.exception.LedgerRecordNotFoundException;
import com.harvestlink.provenance.lifecycle.LifecycleStatusMapper;
import com.harvestlink.provenance.observability.CorrelationContext;
import com.harvestlink.provenance.observability.ProvenanceMetrics;
import com.harvestlink.provenance.offchain.AnchoringRecord;
import com.harvestlink.provenance.offchain.BatchSnapshotHasher;
import com.harvestlink.provenance.offchain.OffChainBatch;
import com.harvestlink.provenance.offchain.OffChainDataStore;
import com.harvestlink.provenance.offchain.SupplyTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Resolves identifiers into verified provenance records.
 *
 * Two sources of truth:
 * 1. Ledger: product ids and legacy batch ids are read straight from ledger state
 * 2. Hybrid: public batch identifiers resolve to the off-chain row, which is
 *    trusted only if every anchoring record is observed on the ledger and its
 *    anchored hash matches the row's current snapshot
 *
 * Never throws. Every failure becomes a result with valid=false and a message.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VerificationResolver {

    private final LedgerClient ledgerClient;
    private final EventSynchronizer synchronizer;
    private final OffChainDataStore offChainDataStore;
    private final IdentifierCodec identifierCodec;
    private final BatchSnapshotHasher snapshotHasher;
    private final LifecycleStatusMapper statusMapper;
    private final CurrencyConverter currencyConverter;
    private final ProvenanceMetrics metrics;

    /**
     * Parses scanned text and verifies what it names.
     */
    public VerificationResult verifyScan(String scannedText) {
        ParsedIdentifier parsed = identifierCodec.parse(scannedText);
        if (!parsed.isIdentifier()) {
            log.debug("Rejected scan: {}", parsed.getReason());
            VerificationResult result = VerificationResult.invalid(
                    null, null, null, VerificationResult.MALFORMED_IDENTIFIER);
            metrics.recordVerification("none", false);
            return result;
        }
        return verifyByIdentifier(parsed.getIdentifier().orElseThrow());
    }

    public VerificationResult verifyByIdentifier(Identifier identifier) {
        if (identifier.getKind() == IdentifierKind.PRODUCT) {
            return verifyProduct(identifier.getId());
        }
        if (identifier.isPublic()) {
            return withIdentifierContext(identifierCodec.url(identifier), () -> resolvePublicBatch(identifier));
        }
        return verifyBatch(identifier.getId());
    }

    public VerificationResult verifyProduct(long productId) {
        return withIdentifierContext("product:" + productId, () -> resolveProduct(productId));
    }

    /**
     * Verifies a batch against ledger state. Custody comes from the mirrored
     * batch events, so it only covers what the synchronizer still retains.
     */
    public VerificationResult verifyBatch(long batchId) {
        return withIdentifierContext("batch:" + batchId, () -> resolveLedgerBatch(batchId));
    }

    // ==================== Ledger path ====================

    private VerificationResult resolveProduct(long productId) {
        ProductWithHistory withHistory;
        try {
            withHistory = ledgerClient.readProductWithHistory(productId);
        } catch (LedgerRecordNotFoundException e) {
            return ledgerFailure(IdentifierKind.PRODUCT, productId, VerificationResult.NOT_FOUND_ON_LEDGER);
        } catch (LedgerException e) {
            log.warn("Ledger read of product {} failed: {}", productId, e.getMessage());
            return ledgerFailure(IdentifierKind.PRODUCT, productId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure reading product {}", productId, e);
            return ledgerFailure(IdentifierKind.PRODUCT, productId, describe(e));
        }

        Product product = withHistory.getProduct();
        ProductRecord record = new ProductRecord(
                product.getId(),
                product.getName(),
                product.getDescription(),
                product.getContentHash(),
                product.getOriginator(),
                product.getCurrentHolder(),
                product.getPriceMinorUnits(),
                currencyConverter.toDisplay(product.getPriceMinorUnits()),
                currencyConverter.getDisplayCurrency(),
                product.getCreatedAt(),
                product.getStatusCode(),
                statusMapper.statusName(product.getStatusCode()),
                product.getCertificates() == null ? List.of() : List.copyOf(product.getCertificates()));

        VerificationResult result = VerificationResult.builder()
                .valid(true)
                .kind(IdentifierKind.PRODUCT)
                .id(productId)
                .record(record)
                .custodyChain(productCustody(product, withHistory.getHolders()))
                .sourceOfTruth(SourceOfTruth.LEDGER)
                .message(VerificationResult.VERIFIED)
                .build();
        metrics.recordVerification(SourceOfTruth.LEDGER.getLabel(), true);
        return result;
    }

    private VerificationResult resolveLedgerBatch(long batchId) {
        Batch batch;
        try {
            batch = ledgerClient.readBatch(batchId);
        } catch (LedgerRecordNotFoundException e) {
            return ledgerFailure(IdentifierKind.BATCH, batchId, VerificationResult.NOT_FOUND_ON_LEDGER);
        } catch (LedgerException e) {
            log.warn("Ledger read of batch {} failed: {}", batchId, e.getMessage());
            return ledgerFailure(IdentifierKind.BATCH, batchId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure reading batch {}", batchId, e);
            return ledgerFailure(IdentifierKind.BATCH, batchId, describe(e));
        }

        BatchRecord record = new BatchRecord(
                batch.getId(),
                batch.getProductIds().stream().sorted().toList(),
                batch.getHandler(),
                batch.getLocation(),
                batch.getCreatedAt(),
                batch.getStatusCode(),
                statusMapper.statusName(batch.getStatusCode()));

        VerificationResult result = VerificationResult.builder()
                .valid(true)
                .kind(IdentifierKind.BATCH)
                .id(batchId)
                .record(record)
                .custodyChain(batchCustody(batchId))
                .sourceOfTruth(SourceOfTruth.LEDGER)
                .message(VerificationResult.VERIFIED)
                .build();
        metrics.recordVerification(SourceOfTruth.LEDGER.getLabel(), true);
        return result;
    }

    private VerificationResult ledgerFailure(IdentifierKind kind, long id, String message) {
        metrics.recordVerification(SourceOfTruth.LEDGER.getLabel(), false);
        return VerificationResult.invalid(kind, id, SourceOfTruth.LEDGER, message);
    }

    /**
     * Holder chain from ledger state, with times and transactions filled in
     * from retained ownership events where they line up.
     */
    private List<CustodyEntry> productCustody(Product product, List<String> holders) {
        List<DomainEvent> events = ascending(synchronizer.productHistory(product.getId()));
        Optional<DomainEvent> creation = events.stream()
                .filter(event -> event.getKind() == DomainEventKind.PRODUCT_CREATED)
                .findFirst();
        List<DomainEvent> transfers = events.stream()
                .filter(event -> event.getKind() == DomainEventKind.OWNERSHIP_TRANSFERRED)
                .toList();

        List<CustodyEntry> chain = new ArrayList<>();
        if (holders.isEmpty()) {
            return chain;
        }
        chain.add(new CustodyEntry("Created", null, holders.get(0),
                creation.map(DomainEvent::getOccurredAt).orElse(product.getCreatedAt()),
                creation.map(DomainEvent::getTransactionRef).orElse(null),
                null));

        int next = 0;
        for (int i = 1; i < holders.size(); i++) {
            String from = holders.get(i - 1);
            String to = holders.get(i);
            Instant at = null;
            String tx = null;
            if (next < transfers.size()) {
                DomainEvent transfer = transfers.get(next);
                OwnershipTransferredPayload payload = (OwnershipTransferredPayload) transfer.getPayload();
                if (payload.previousHolder().equalsIgnoreCase(from) && payload.newHolder().equalsIgnoreCase(to)) {
                    at = transfer.getOccurredAt();
                    tx = transfer.getTransactionRef();
                    next++;
                }
            }
            chain.add(new CustodyEntry("Ownership transferred", from, to, at, tx, null));
        }
        return chain;
    }

    private List<CustodyEntry> batchCustody(long batchId) {
        List<CustodyEntry> chain = new ArrayList<>();
        String holder = null;
        for (DomainEvent event : ascending(synchronizer.batchHistory(batchId))) {
            switch (event.getKind()) {
                case BATCH_CREATED: {
                    BatchCreatedPayload created = (BatchCreatedPayload) event.getPayload();
                    holder = created.creator();
                    chain.add(new CustodyEntry("Created", null, holder, event.getOccurredAt(),
                            event.getTransactionRef(), created.location()));
                    break;
                }
                case BATCH_LOCATION_UPDATED: {
                    BatchLocationUpdatedPayload moved = (BatchLocationUpdatedPayload) event.getPayload();
                    chain.add(new CustodyEntry("Location updated", holder, moved.updatedBy(), event.getOccurredAt(),
                            event.getTransactionRef(), moved.location()));
                    holder = moved.updatedBy();
                    break;
                }
                case BATCH_PURCHASED: {
                    BatchPurchasedPayload purchased = (BatchPurchasedPayload) event.getPayload();
                    chain.add(new CustodyEntry("Purchased", purchased.seller(), purchased.buyer(),
                            event.getOccurredAt(), event.getTransactionRef(),
                            currencyConverter.toDisplay(purchased.priceWei()).toPlainString()
                                    + " " + currencyConverter.getDisplayCurrency()));
                    holder = purchased.buyer();
                    break;
                }
                default:
                    break;
            }
        }
        return chain;
    }

    // ==================== Hybrid path ====================

    private VerificationResult resolvePublicBatch(Identifier identifier) {
        long batchId = identifier.getId();
        Optional<OffChainBatch> found;
        try {
            found = offChainDataStore.findBatchByQrCode(identifierCodec.url(identifier));
            if (found.isEmpty()) {
                found = offChainDataStore.findBatchById(batchId);
            }
        } catch (RuntimeException e) {
            log.error("Off-chain lookup of batch {} failed", batchId, e);
            return hybridFailure(batchId, "off-chain store unavailable: " + describe(e));
        }

        if (found.isEmpty()) {
            log.info("No off-chain batch for identifier {}", identifierCodec.url(identifier));
            return hybridFailure(batchId, VerificationResult.UNKNOWN_IDENTIFIER);
        }

        OffChainBatch batch = found.get();
        List<AnchoringRecord> anchors;
        List<SupplyTransaction> transactions;
        try {
            anchors = offChainDataStore.findAnchoringRecords(batch.getId());
            transactions = offChainDataStore.findSupplyTransactions(batch.getId());
        } catch (RuntimeException e) {
            log.error("Off-chain anchor lookup of batch {} failed", batch.getId(), e);
            return hybridFailure(batchId, "off-chain store unavailable: " + describe(e));
        }

        String currentHash = snapshotHasher.hash(batch);
        List<AnchorCheck> checks = anchors.stream()
                .map(anchor -> check(anchor, currentHash))
                .toList();

        String message;
        if (checks.isEmpty()) {
            message = VerificationResult.NO_ANCHORING_RECORDS;
        } else if (checks.stream().anyMatch(check -> !check.dataIntact())) {
            message = VerificationResult.DATA_HASH_MISMATCH;
            log.warn("Batch {} snapshot hash {} does not match its anchors", batch.getId(), currentHash);
        } else if (checks.stream().anyMatch(check -> !check.observedOnLedger())) {
            message = VerificationResult.ANCHOR_NOT_CONFIRMED;
        } else {
            message = VerificationResult.VERIFIED;
        }
        boolean valid = VerificationResult.VERIFIED.equals(message);

        metrics.recordVerification(SourceOfTruth.HYBRID.getLabel(), valid);
        return VerificationResult.builder()
                .valid(valid)
                .kind(IdentifierKind.BATCH)
                .id(batchId)
                .record(publicRecord(batch))
                .custodyChain(offChainCustody(batch, transactions))
                .sourceOfTruth(SourceOfTruth.HYBRID)
                .message(message)
                .anchorChecks(checks)
                .build();
    }

    private AnchorCheck check(AnchoringRecord anchor, String currentHash) {
        boolean observed = anchor.isVerified()
                || synchronizer.findByTransactionRef(anchor.getTransactionHash()).isPresent();
        boolean intact = currentHash.equalsIgnoreCase(anchor.getDataHash());
        return new AnchorCheck(anchor.getTransactionHash(), anchor.getBlockNumber(), anchor.getDataHash(),
                observed, intact);
    }

    private VerificationResult hybridFailure(long batchId, String message) {
        metrics.recordVerification(SourceOfTruth.HYBRID.getLabel(), false);
        return VerificationResult.invalid(IdentifierKind.BATCH, batchId, SourceOfTruth.HYBRID, message);
    }

    private static PublicBatchRecord publicRecord(OffChainBatch batch) {
        OffChainBatch.CropDetails crop = batch.getCrop();
        return new PublicBatchRecord(
                batch.getId(),
                batch.getBatchNumber(),
                batch.getQrCode(),
                batch.getStatus(),
                crop.getName(),
                crop.getDescription(),
                batch.getQuantity(),
                batch.getUnit(),
                batch.getPricePerUnit(),
                crop.getHarvestDate(),
                crop.getLocation(),
                crop.getCertifications(),
                crop.getFarmerName(),
                batch.getLedgerBatchId());
    }

    private static List<CustodyEntry> offChainCustody(OffChainBatch batch, List<SupplyTransaction> transactions) {
        OffChainBatch.CropDetails crop = batch.getCrop();
        List<CustodyEntry> chain = new ArrayList<>();
        chain.add(new CustodyEntry("Crop registration", null, crop.getFarmerName(), crop.getCreatedAt(),
                null, crop.getLocation()));
        transactions.stream()
                .sorted(Comparator.comparing(SupplyTransaction::getCreatedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .forEach(tx -> chain.add(new CustodyEntry("Purchase", tx.getSeller(), tx.getBuyer(),
                        tx.getCreatedAt(), tx.getTransactionHash(),
                        tx.getQuantity().stripTrailingZeros().toPlainString() + " " + batch.getUnit()
                                + " for " + tx.getTotalPrice().stripTrailingZeros().toPlainString())));
        return chain;
    }

    // ==================== Helpers ====================

    private VerificationResult withIdentifierContext(String identifier, Supplier<VerificationResult> resolution) {
        String previous = MDC.get(CorrelationContext.IDENTIFIER_MDC_KEY);
        MDC.put(CorrelationContext.IDENTIFIER_MDC_KEY, identifier);
        try {
            VerificationResult result = metrics.timeVerification(resolution);
            log.info("Verified {}: valid={}, source={}, message={}",
                    identifier, result.isValid(), result.getSourceOfTruth(), result.getMessage());
            return result;
        } finally {
            if (previous == null) {
                MDC.remove(CorrelationContext.IDENTIFIER_MDC_KEY);
            } else {
                MDC.put(CorrelationContext.IDENTIFIER_MDC_KEY, previous);
            }
        }
    }

    private static List<DomainEvent> ascending(List<DomainEvent> newestFirst) {
        List<DomainEvent> events = new ArrayList<>(newestFirst);
        events.sort(Comparator.comparing(DomainEvent::getSequenceKey));
        return events;
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
