package com.harvestlink.provenance.event.payload;

public record StatusUpdatedPayload(long productId, int statusCode, String updatedBy) implements EventPayload {

    @Override
    public boolean concernsProduct(long id) {
        return productId == id;
    }
}
