package com.harvestlink.provenance.event;

import java.util.Comparator;

/**
 * Position of a log on the ledger. Totally ordered, and the deduplication
 * key of the synchronizer.
 */
public record SequenceKey(long blockNumber, int logIndex) implements Comparable<SequenceKey> {

    private static final Comparator<SequenceKey> ORDER = Comparator
            .comparingLong(SequenceKey::blockNumber)
            .thenComparingInt(SequenceKey::logIndex);

    public SequenceKey {
        if (blockNumber < 0 || logIndex < 0) {
            throw new IllegalArgumentException("Sequence key components must be non-negative");
        }
    }

    @Override
    public int compareTo(SequenceKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return blockNumber + ":" + logIndex;
    }
}
