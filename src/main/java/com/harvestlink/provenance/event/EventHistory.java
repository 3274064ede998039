package com.harvestlink.provenance.event;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Bounded, ordered record of mirrored events.
 *
 * When full, the oldest event is evicted and its key becomes the low
 * watermark. Keys at or below the watermark count as recorded, so an evicted
 * event redelivered by the provider is not accepted a second time.
 */
public class EventHistory {

    private final int capacity;
    private final TreeMap<SequenceKey, DomainEvent> events = new TreeMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private SequenceKey watermark;

    public EventHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be at least 1");
        }
        this.capacity = capacity;
    }

    public boolean isRecorded(SequenceKey key) {
        lock.readLock().lock();
        try {
            return belowWatermark(key) || events.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Inserts the event unless its key was already recorded.
     *
     * @return true if the event was added
     */
    public boolean record(DomainEvent event) {
        SequenceKey key = event.getSequenceKey();
        lock.writeLock().lock();
        try {
            if (belowWatermark(key) || events.containsKey(key)) {
                return false;
            }
            events.put(key, event);
            while (events.size() > capacity) {
                watermark = events.pollFirstEntry().getKey();
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Snapshot of matching events, newest first.
     */
    public List<DomainEvent> snapshot(Predicate<DomainEvent> filter) {
        lock.readLock().lock();
        try {
            List<DomainEvent> result = new ArrayList<>();
            for (DomainEvent event : events.descendingMap().values()) {
                if (filter.test(event)) {
                    result.add(event);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<DomainEvent> findByTransactionRef(String transactionHash) {
        if (transactionHash == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            for (Map.Entry<SequenceKey, DomainEvent> entry : events.entrySet()) {
                if (transactionHash.equalsIgnoreCase(entry.getValue().getTransactionRef())) {
                    return Optional.of(entry.getValue());
                }
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return events.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<SequenceKey> getWatermark() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(watermark);
        } finally {
            lock.readLock().unlock();
        }
    }

    private boolean belowWatermark(SequenceKey key) {
        return watermark != null && key.compareTo(watermark) <= 0;
    }
}
