package com.harvestlink.provenance.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * A shipment grouping one or more products.
 */
@Value
@Builder(toBuilder = true)
public class Batch {
    long id;
    Set<Long> productIds;
    String handler;
    Instant createdAt;
    String location;
    int statusCode;
}
