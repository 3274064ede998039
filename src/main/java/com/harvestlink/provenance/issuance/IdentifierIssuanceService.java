package com.harvestlink.provenance.issuance;

import com.harvestlink.provenance.event.DomainEventKind;
import com.harvestlink.provenance.event.EventSynchronizer;
import com.harvestlink.provenance.identifier.Identifier;
import com.harvestlink.provenance.identifier.IdentifierCodec;
import com.harvestlink.provenance.identifier.IdentifierKind;
import com.harvestlink.provenance.identifier.IssuedIdentifier;
import com.harvestlink.provenance.ledger.ContractCall;
import com.harvestlink.provenance.ledger.CurrencyConverter;
import com.harvestlink.provenance.ledger.LedgerClient;
import com.harvestlink.provenance.ledger.TransactionRef;
import com.harvestlink.provenance.observability.ProvenanceMetrics;
import com.harvestlink.provenance.offchain.AnchoringRecord;
import com.harvestlink.provenance.offchain.BatchSnapshotHasher;
import com.harvestlink.provenance.offchain.CropRegistration;
import com.harvestlink.provenance.offchain.OffChainBatch;
import com.harvestlink.provenance.offchain.OffChainDataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.util.List;

/**
 * Issues scan identifiers and anchors off-chain batches to the ledger.
 *
 * Registration flow for a crop listed off-chain:
 * 1. Store crop and batch, the batch's QR code pending
 * 2. Mint a public batch identifier from the generated batch id
 * 3. Store the identifier URL as the batch's QR code
 * 4. Anchor the snapshot hash to a ledger transaction, now or later
 *
 * An anchor starts unverified and is confirmed once its transaction shows up
 * in the mirrored ledger events ({@link AnchorConfirmationObserver}).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdentifierIssuanceService {

    private static final String BATCH_SUFFIX_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int BATCH_SUFFIX_LENGTH = 7;
    private static final SecureRandom SUFFIX_RANDOM = new SecureRandom();

    private final IdentifierCodec identifierCodec;
    private final OffChainDataStore offChainDataStore;
    private final BatchSnapshotHasher snapshotHasher;
    private final LedgerClient ledgerClient;
    private final EventSynchronizer synchronizer;
    private final CurrencyConverter currencyConverter;
    private final ProvenanceMetrics metrics;

    /**
     * Mints an identifier for an id the caller already knows.
     */
    public IssuedIdentifier issue(IdentifierKind kind, long id) {
        IssuedIdentifier issued = identifierCodec.mint(kind, id);
        metrics.recordIdentifierIssued(kind.name(), issued.getAssurance().name());
        return issued;
    }

    public RegisteredCrop registerCrop(CropRegistration registration) {
        OffChainBatch batch = offChainDataStore.registerCrop(registration, newBatchNumber());
        IssuedIdentifier identifier = issue(IdentifierKind.BATCH, batch.getId());
        OffChainBatch issued = offChainDataStore.assignQrCode(batch.getId(), identifier.getUrl());
        return new RegisteredCrop(issued, identifier);
    }

    /**
     * Mints a public identifier for an existing off-chain batch and stores its
     * URL as the batch's QR code.
     *
     * @throws IllegalArgumentException if the batch does not exist
     * @throws IllegalStateException if the batch already has an identifier
     */
    public IssuedIdentifier issuePublicBatchIdentifier(long offChainBatchId) {
        OffChainBatch batch = offChainDataStore.findBatchById(offChainBatchId)
                .orElseThrow(() -> new IllegalArgumentException("Off-chain batch not found: " + offChainBatchId));
        if (batch.hasIssuedQrCode()) {
            throw new IllegalStateException("Batch " + offChainBatchId + " already has an issued identifier");
        }
        IssuedIdentifier identifier = issue(IdentifierKind.BATCH, batch.getId());
        offChainDataStore.assignQrCode(batch.getId(), identifier.getUrl());
        return identifier;
    }

    /**
     * Records that a ledger transaction anchors the batch's current snapshot.
     * Confirmed immediately when the transaction is already in the mirrored history.
     *
     * @throws IllegalArgumentException if the transaction is older than the
     *         retained history, since it could never be confirmed
     */
    public AnchoringRecord anchor(long offChainBatchId, String transactionHash, long blockNumber) {
        OffChainBatch batch = offChainDataStore.findBatchById(offChainBatchId)
                .orElseThrow(() -> new IllegalArgumentException("Off-chain batch not found: " + offChainBatchId));
        boolean mirrored = synchronizer.findByTransactionRef(transactionHash).isPresent();
        if (!mirrored) {
            synchronizer.evictionWatermark()
                    .filter(watermark -> blockNumber <= watermark.blockNumber())
                    .ifPresent(watermark -> {
                        throw new IllegalArgumentException("Transaction " + transactionHash + " in block "
                                + blockNumber + " is older than the retained ledger events (evicted through block "
                                + watermark.blockNumber() + ") and cannot be confirmed");
                    });
        }

        String dataHash = snapshotHasher.hash(batch);
        AnchoringRecord record = offChainDataStore.saveAnchoringRecord(
                batch.getId(), transactionHash, blockNumber, dataHash);

        if (mirrored && offChainDataStore.confirmAnchors(transactionHash) > 0) {
            return offChainDataStore.findAnchoringRecords(batch.getId()).stream()
                    .filter(anchor -> anchor.getId() == record.getId())
                    .findFirst()
                    .orElse(record);
        }
        return record;
    }

    public AnchoringRecord anchor(long offChainBatchId, TransactionRef transaction) {
        return anchor(offChainBatchId, transaction.getHash(), transaction.getBlockNumber());
    }

    /**
     * Creates a product on the ledger and mints its identifier. The product id
     * is taken from the ProductCreated log of the included transaction.
     */
    public RegisteredProduct registerLedgerProduct(String name, String description, String contentHash,
                                                   BigDecimal displayPrice) {
        TransactionRef tx = ledgerClient.submit(new ContractCall.CreateProduct(
                name, description, contentHash, currencyConverter.toWei(displayPrice)));
        long productId = tx.createdId(DomainEventKind.PRODUCT_CREATED.getEventName())
                .orElseThrow(() -> new IllegalStateException(
                        "Transaction " + tx.getHash() + " did not report a created product"));
        log.info("Ledger product {} created in tx {}", productId, tx.getHash());
        return new RegisteredProduct(productId, tx.getHash(), tx.getBlockNumber(),
                issue(IdentifierKind.PRODUCT, productId));
    }

    /**
     * Creates a batch on the ledger and mints its identifier. When an
     * off-chain batch is given, it is linked to the ledger batch and anchored
     * to the creating transaction.
     */
    public RegisteredBatch registerLedgerBatch(List<Long> productIds, String location, Long offChainBatchId) {
        if (offChainBatchId != null && offChainDataStore.findBatchById(offChainBatchId).isEmpty()) {
            throw new IllegalArgumentException("Off-chain batch not found: " + offChainBatchId);
        }

        TransactionRef tx = ledgerClient.submit(new ContractCall.CreateBatch(productIds, location));
        long batchId = tx.createdId(DomainEventKind.BATCH_CREATED.getEventName())
                .orElseThrow(() -> new IllegalStateException(
                        "Transaction " + tx.getHash() + " did not report a created batch"));
        log.info("Ledger batch {} created in tx {}", batchId, tx.getHash());

        AnchoringRecord anchor = null;
        if (offChainBatchId != null) {
            offChainDataStore.linkLedgerBatch(offChainBatchId, batchId);
            anchor = anchor(offChainBatchId, tx);
        }
        return new RegisteredBatch(batchId, tx.getHash(), tx.getBlockNumber(),
                identifierCodec.url(Identifier.legacy(IdentifierKind.BATCH, batchId)), anchor);
    }

    /**
     * BATCH-&lt;epoch millis&gt;-&lt;7 base36 chars&gt;
     */
    String newBatchNumber() {
        StringBuilder suffix = new StringBuilder(BATCH_SUFFIX_LENGTH);
        for (int i = 0; i < BATCH_SUFFIX_LENGTH; i++) {
            suffix.append(BATCH_SUFFIX_ALPHABET.charAt(SUFFIX_RANDOM.nextInt(BATCH_SUFFIX_ALPHABET.length())));
        }
        return "BATCH-" + System.currentTimeMillis() + "-" + suffix;
    }
}
