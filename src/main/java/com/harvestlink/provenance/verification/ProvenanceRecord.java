package com.harvestlink.provenance.verification;

/**
 * Human-readable record attached to a verification result.
 */
public sealed interface ProvenanceRecord permits ProductRecord, BatchRecord, PublicBatchRecord {
}
