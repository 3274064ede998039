package com.harvestlink.provenance.ledger;

import lombok.Value;

import java.util.List;

/**
 * A log entry exactly as the ledger provider delivers it.
 *
 * Arguments are positional and loosely typed (ids and amounts as
 * {@link java.math.BigInteger}, addresses and text as {@link String},
 * id arrays as lists). They are validated when normalized into domain events.
 */
@Value
public class RawLog {
    String eventName;
    long blockNumber;
    int logIndex;
    String transactionHash;
    List<Object> args;
}
