package com.harvestlink.provenance.event;

import java.util.Arrays;
import java.util.Optional;

/**
 * Ledger events mirrored by the synchronizer, keyed by their contract event name.
 */
public enum DomainEventKind {
    PRODUCT_CREATED("ProductCreated"),
    BATCH_CREATED("BatchCreated"),
    OWNERSHIP_TRANSFERRED("OwnershipTransferred"),
    STATUS_UPDATED("StatusUpdated"),
    BATCH_LOCATION_UPDATED("BatchLocationUpdated"),
    BATCH_PURCHASED("BatchPurchased");

    private final String eventName;

    DomainEventKind(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }

    public static Optional<DomainEventKind> fromEventName(String eventName) {
        return Arrays.stream(values())
                .filter(kind -> kind.eventName.equals(eventName))
                .findFirst();
    }
}
