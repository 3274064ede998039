package com.harvestlink.provenance.verification;

import java.time.Instant;
import java.util.List;

/**
 * A batch as read from the ledger.
 */
public record BatchRecord(
        long id,
        List<Long> productIds,
        String handler,
        String location,
        Instant createdAt,
        int statusCode,
        String statusName) implements ProvenanceRecord {
}
