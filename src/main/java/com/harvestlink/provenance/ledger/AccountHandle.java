package com.harvestlink.provenance.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * The wallet account a session acts as.
 */
@Value
public class AccountHandle {
    String address;
    Instant connectedAt;
}
