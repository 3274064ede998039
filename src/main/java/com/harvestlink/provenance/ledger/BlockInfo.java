package com.harvestlink.provenance.ledger;

import lombok.Value;

import java.time.Instant;

@Value
public class BlockInfo {
    long number;
    Instant timestamp;
}
