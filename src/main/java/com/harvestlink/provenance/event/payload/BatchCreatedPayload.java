package com.harvestlink.provenance.event.payload;

import java.util.List;

public record BatchCreatedPayload(long batchId, List<Long> productIds, String creator, String location)
        implements EventPayload {

    public BatchCreatedPayload {
        productIds = List.copyOf(productIds);
    }

    @Override
    public boolean concernsProduct(long id) {
        return productIds.contains(id);
    }

    @Override
    public boolean concernsBatch(long id) {
        return batchId == id;
    }
}
