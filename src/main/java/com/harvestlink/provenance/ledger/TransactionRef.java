package com.harvestlink.provenance.ledger;

import lombok.Value;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Reference to an included transaction and the logs it emitted.
 */
@Value
public class TransactionRef {
    String hash;
    long blockNumber;
    List<RawLog> logs;

    public Optional<RawLog> firstLog(String eventName) {
        return logs.stream()
                .filter(log -> log.getEventName().equals(eventName))
                .findFirst();
    }

    /**
     * Reads the id a creation event reports in its first argument,
     * e.g. the productId of ProductCreated.
     */
    public OptionalLong createdId(String eventName) {
        return firstLog(eventName)
                .filter(log -> !log.getArgs().isEmpty() && log.getArgs().get(0) instanceof BigInteger)
                .map(log -> OptionalLong.of(((BigInteger) log.getArgs().get(0)).longValueExact()))
                .orElse(OptionalLong.empty());
    }
}
