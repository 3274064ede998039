package com.harvestlink.provenance.event;

import com.harvestlink.provenance.event.payload.EventPayload;
import lombok.Value;

import java.time.Instant;

/**
 * A normalized ledger event.
 *
 * Immutable. The payload type always matches the kind.
 */
@Value
public class DomainEvent {
    DomainEventKind kind;
    SequenceKey sequenceKey;
    String transactionRef;
    Instant occurredAt;
    EventPayload payload;

    public long getBlockNumber() {
        return sequenceKey.blockNumber();
    }
}
