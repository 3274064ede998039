package com.harvestlink.provenance.event.payload;

import java.math.BigInteger;

public record ProductCreatedPayload(long productId, String name, String originator, BigInteger priceWei)
        implements EventPayload {

    @Override
    public boolean concernsProduct(long id) {
        return productId == id;
    }
}
