package com.harvestlink.provenance.event.payload;

import java.math.BigInteger;

public record BatchPurchasedPayload(long batchId, String buyer, String seller, BigInteger priceWei)
        implements EventPayload {

    @Override
    public boolean concernsBatch(long id) {
        return batchId == id;
    }
}
