package com.harvestlink.provenance.offchain;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Relational store of produce listings and their ledger anchors.
 *
 * Lookups return empty for unknown rows; writes against a missing batch
 * throw {@link IllegalArgumentException}.
 */
public interface OffChainDataStore {

    Optional<OffChainBatch> findBatchByQrCode(String qrCode);

    Optional<OffChainBatch> findBatchById(long batchId);

    List<AnchoringRecord> findAnchoringRecords(long batchId);

    List<AnchoringRecord> findAnchoringRecordsByTransaction(String transactionHash);

    /**
     * Supply transactions of a batch, oldest first.
     */
    List<SupplyTransaction> findSupplyTransactions(long batchId);

    /**
     * Creates the crop and its batch. The batch starts with a pending QR code.
     */
    OffChainBatch registerCrop(CropRegistration registration, String batchNumber);

    OffChainBatch assignQrCode(long batchId, String qrCode);

    OffChainBatch linkLedgerBatch(long batchId, long ledgerBatchId);

    AnchoringRecord saveAnchoringRecord(long batchId, String transactionHash, long blockNumber, String dataHash);

    /**
     * Marks every unverified anchor of the transaction as verified.
     *
     * @return number of records changed
     */
    int confirmAnchors(String transactionHash);

    /**
     * Records a purchase of part or all of an available batch and reduces its
     * remaining quantity.
     *
     * @throws IllegalStateException if the batch is not available or the quantity exceeds what remains
     */
    SupplyTransaction recordPurchase(long batchId, String buyer, BigDecimal quantity, String transactionHash);
}
