package com.harvestlink.provenance.offchain;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
public class SupplyTransaction {
    public static final String STATUS_COMPLETED = "completed";

    long id;
    long batchId;
    String buyer;
    String seller;
    BigDecimal quantity;
    BigDecimal totalPrice;
    String status;
    String transactionHash;
    Instant createdAt;
}
