package com.harvestlink.provenance.event.payload;

/**
 * Typed arguments of a ledger event, one record per event kind.
 */
public sealed interface EventPayload
        permits ProductCreatedPayload, BatchCreatedPayload, OwnershipTransferredPayload,
                StatusUpdatedPayload, BatchLocationUpdatedPayload, BatchPurchasedPayload {

    default boolean concernsProduct(long productId) {
        return false;
    }

    default boolean concernsBatch(long batchId) {
        return false;
    }
}
