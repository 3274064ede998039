package com.harvestlink.provenance.verification;

import java.time.Instant;

/**
 * One holder transition. fromHolder is null for the originating entry;
 * occurredAt and transactionRef are null when the transition is known only
 * from ledger state and not from a retained event.
 */
public record CustodyEntry(
        String step,
        String fromHolder,
        String toHolder,
        Instant occurredAt,
        String transactionRef,
        String note) {
}
