package com.harvestlink.provenance.event.payload;

public record OwnershipTransferredPayload(long productId, String previousHolder, String newHolder)
        implements EventPayload {

    @Override
    public boolean concernsProduct(long id) {
        return productId == id;
    }
}
