package com.harvestlink.provenance.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * Product as held in current ledger state.
 *
 * Created by a ledger transaction and never deleted. Only currentHolder and
 * statusCode change afterwards.
 */
@Value
@Builder(toBuilder = true)
public class Product {
    long id;
    String name;
    String description;
    String contentHash;
    String originator;
    String currentHolder;
    BigInteger priceMinorUnits;
    Instant createdAt;
    int statusCode;
    List<String> certificates;
}
