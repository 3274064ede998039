package com.harvestlink.provenance.offchain;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed off-chain store.
 *
 * Entities never leave this class: every method converts to domain values
 * inside its transaction, so lazy associations are resolved before return.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaOffChainDataStore implements OffChainDataStore {

    private final CropRepository cropRepository;
    private final OffChainBatchRepository batchRepository;
    private final AnchoringRecordRepository anchoringRecordRepository;
    private final SupplyTransactionRepository supplyTransactionRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<OffChainBatch> findBatchByQrCode(String qrCode) {
        if (qrCode == null || OffChainBatch.PENDING_QR_CODE.equals(qrCode)) {
            return Optional.empty();
        }
        return batchRepository.findByQrCode(qrCode).map(OffChainBatchEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OffChainBatch> findBatchById(long batchId) {
        return batchRepository.findById(batchId).map(OffChainBatchEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AnchoringRecord> findAnchoringRecords(long batchId) {
        return anchoringRecordRepository.findByBatchIdOrderByRecordedAtAscIdAsc(batchId).stream()
                .map(AnchoringRecordEntity::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<AnchoringRecord> findAnchoringRecordsByTransaction(String transactionHash) {
        return anchoringRecordRepository.findByTransactionHashIgnoreCase(transactionHash).stream()
                .map(AnchoringRecordEntity::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<SupplyTransaction> findSupplyTransactions(long batchId) {
        return supplyTransactionRepository.findByBatchIdOrderByCreatedAtAscIdAsc(batchId).stream()
                .map(SupplyTransactionEntity::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public OffChainBatch registerCrop(CropRegistration registration, String batchNumber) {
        registration.validate();
        if (batchRepository.existsByBatchNumber(batchNumber)) {
            throw new IllegalStateException("Batch number already in use: " + batchNumber);
        }

        CropEntity crop = cropRepository.save(CropEntity.fromRegistration(registration));
        OffChainBatchEntity batch = batchRepository.save(OffChainBatchEntity.forCrop(crop, batchNumber));
        log.info("Registered crop {} ({}) as batch {} [{}]",
                crop.getId(), crop.getName(), batch.getId(), batchNumber);
        return batch.toDomain();
    }

    @Override
    @Transactional
    public OffChainBatch assignQrCode(long batchId, String qrCode) {
        OffChainBatchEntity batch = requireBatch(batchId);
        batch.assignQrCode(qrCode);
        batchRepository.saveAndFlush(batch);
        log.info("Issued identifier for batch {}: {}", batchId, qrCode);
        return batch.toDomain();
    }

    @Override
    @Transactional
    public OffChainBatch linkLedgerBatch(long batchId, long ledgerBatchId) {
        OffChainBatchEntity batch = requireBatch(batchId);
        batch.linkLedgerBatch(ledgerBatchId);
        batchRepository.save(batch);
        log.info("Linked batch {} to ledger batch {}", batchId, ledgerBatchId);
        return batch.toDomain();
    }

    @Override
    @Transactional
    public AnchoringRecord saveAnchoringRecord(long batchId, String transactionHash, long blockNumber, String dataHash) {
        requireBatch(batchId);
        if (transactionHash == null || transactionHash.isBlank()) {
            throw new IllegalArgumentException("Transaction hash is required");
        }
        if (blockNumber < 0) {
            throw new IllegalArgumentException("Block number must be non-negative");
        }
        AnchoringRecordEntity saved = anchoringRecordRepository.save(
                AnchoringRecordEntity.unverified(batchId, transactionHash, blockNumber, dataHash));
        log.info("Anchored batch {} to tx {} (block {})", batchId, transactionHash, blockNumber);
        return saved.toDomain();
    }

    @Override
    @Transactional
    public int confirmAnchors(String transactionHash) {
        int confirmed = anchoringRecordRepository.confirmByTransactionHash(transactionHash);
        if (confirmed > 0) {
            log.info("Confirmed {} anchoring record(s) for tx {}", confirmed, transactionHash);
        }
        return confirmed;
    }

    @Override
    @Transactional
    public SupplyTransaction recordPurchase(long batchId, String buyer, BigDecimal quantity, String transactionHash) {
        if (buyer == null || buyer.isBlank()) {
            throw new IllegalArgumentException("Buyer is required");
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }

        OffChainBatchEntity batch = batchRepository.findByIdForUpdate(batchId)
                .orElseThrow(() -> new IllegalArgumentException("Off-chain batch not found: " + batchId));
        CropEntity crop = batch.getCrop();
        boolean exhausted = batch.reduceQuantity(quantity);
        if (exhausted) {
            crop.markSold();
        }

        BigDecimal totalPrice = quantity.multiply(batch.getPricePerUnit()).setScale(4, RoundingMode.HALF_UP);
        SupplyTransactionEntity saved = supplyTransactionRepository.save(SupplyTransactionEntity.completed(
                batchId, buyer, crop.getFarmerName(), quantity, totalPrice, transactionHash));

        log.info("Recorded purchase of {} {} from batch {} by {} (remaining {})",
                quantity, batch.getUnit(), batchId, buyer, batch.getQuantity());
        return saved.toDomain();
    }

    private OffChainBatchEntity requireBatch(long batchId) {
        return batchRepository.findById(batchId)
                .orElseThrow(() -> new IllegalArgumentException("Off-chain batch not found: " + batchId));
    }
}
