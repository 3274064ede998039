package com.harvestlink.provenance.event;

import com.harvestlink.provenance.ledger.LedgerClient;
import com.harvestlink.provenance.ledger.RawLog;
import com.harvestlink.provenance.ledger.Subscription;
import com.harvestlink.provenance.observability.ProvenanceMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Mirrors ledger events into a bounded local history and fans them out to
 * observers.
 *
 * Delivery pipeline for each raw log:
 * 1. Discard if its (block, logIndex) key was already recorded
 * 2. Normalize into a typed {@link DomainEvent}; malformed logs are dropped
 * 3. Record in history
 * 4. Invoke observers of that kind, then wildcard observers
 *
 * Key design decisions:
 * - Deliveries of one kind are serialized by a fair lock; different kinds run concurrently
 * - The ledger may redeliver logs, so deduplication is by sequence key, not by arrival
 * - An observer failure is logged and counted, never propagated
 * - Once stop() returns, no further observer invocation starts
 */
@Service
@Slf4j
public class EventSynchronizer implements SmartLifecycle {

    private final LedgerClient ledgerClient;
    private final EventNormalizer normalizer;
    private final ProvenanceMetrics metrics;
    private final EventHistory history;
    private final ObserverRegistry observers = new ObserverRegistry();
    private final boolean autoStart;
    private final Duration stopTimeout;

    private final Map<DomainEventKind, KindStream> streams = new EnumMap<>(DomainEventKind.class);
    private final Object lifecycleLock = new Object();
    private final Object drainMonitor = new Object();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final ThreadLocal<int[]> deliveryDepth = ThreadLocal.withInitial(() -> new int[1]);
    private volatile boolean running;

    public EventSynchronizer(LedgerClient ledgerClient,
                             EventNormalizer normalizer,
                             ProvenanceMetrics metrics,
                             @Value("${provenance.events.history-capacity:10000}") int historyCapacity,
                             @Value("${provenance.events.stop-timeout-ms:5000}") long stopTimeoutMs,
                             @Value("${provenance.events.auto-start:true}") boolean autoStart) {
        this.ledgerClient = ledgerClient;
        this.normalizer = normalizer;
        this.metrics = metrics;
        this.history = new EventHistory(historyCapacity);
        this.stopTimeout = Duration.ofMillis(stopTimeoutMs);
        this.autoStart = autoStart;
        for (DomainEventKind kind : DomainEventKind.values()) {
            streams.put(kind, new KindStream(kind));
        }
    }

    // ==================== Lifecycle ====================

    /**
     * Subscribes to every event kind. Calling it while already started does nothing.
     */
    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                return;
            }
            running = true;
            for (KindStream stream : streams.values()) {
                stream.open();
            }
            log.info("Event synchronizer started: {}", getStates());
        }
    }

    /**
     * Unsubscribes every kind and waits for in-flight deliveries to drain,
     * bounded by the configured stop timeout. Safe to call when stopped, and
     * from inside an observer.
     */
    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            for (KindStream stream : streams.values()) {
                stream.close();
            }
        }
        awaitDrain();
        log.info("Event synchronizer stopped, {} events retained", history.size());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }

    public SynchronizerState getState(DomainEventKind kind) {
        return streams.get(kind).state;
    }

    public Map<DomainEventKind, SynchronizerState> getStates() {
        Map<DomainEventKind, SynchronizerState> states = new EnumMap<>(DomainEventKind.class);
        streams.forEach((kind, stream) -> states.put(kind, stream.state));
        return Collections.unmodifiableMap(states);
    }

    // ==================== Observers ====================

    public Subscription subscribe(DomainEventKind kind, DomainEventObserver observer) {
        return observers.register(kind, observer);
    }

    public Subscription subscribeAll(DomainEventObserver observer) {
        return observers.registerWildcard(observer);
    }

    /**
     * Subscribes by contract event name, or to everything with "*".
     */
    public Subscription subscribe(String eventName, DomainEventObserver observer) {
        if ("*".equals(eventName)) {
            return subscribeAll(observer);
        }
        DomainEventKind kind = DomainEventKind.fromEventName(eventName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown event name: " + eventName));
        return subscribe(kind, observer);
    }

    // ==================== History ====================

    public List<DomainEvent> history() {
        return history.snapshot(event -> true);
    }

    public List<DomainEvent> history(Predicate<DomainEvent> filter) {
        return history.snapshot(filter);
    }

    public List<DomainEvent> history(DomainEventKind kind) {
        return history.snapshot(event -> event.getKind() == kind);
    }

    public List<DomainEvent> productHistory(long productId) {
        return history.snapshot(event -> event.getPayload().concernsProduct(productId));
    }

    public List<DomainEvent> batchHistory(long batchId) {
        return history.snapshot(event -> event.getPayload().concernsBatch(batchId));
    }

    public Optional<DomainEvent> findByTransactionRef(String transactionHash) {
        return history.findByTransactionRef(transactionHash);
    }

    /**
     * Key of the newest evicted event. Anything at or below it is no longer retained.
     */
    public Optional<SequenceKey> evictionWatermark() {
        return history.getWatermark();
    }

    // ==================== Delivery ====================

    void deliver(DomainEventKind kind, RawLog raw) {
        KindStream stream = streams.get(kind);
        stream.lock.lock();
        inFlight.incrementAndGet();
        deliveryDepth.get()[0]++;
        try {
            if (!running) {
                log.debug("Ignoring {} delivered after stop", kind.getEventName());
                return;
            }
            metrics.recordEventReceived(kind.getEventName());

            SequenceKey key;
            try {
                key = new SequenceKey(raw.getBlockNumber(), raw.getLogIndex());
            } catch (IllegalArgumentException e) {
                reject(kind, raw, e.getMessage());
                return;
            }
            if (history.isRecorded(key)) {
                discardDuplicate(kind, key);
                return;
            }

            Instant occurredAt = ledgerClient.blockTimestamp(raw.getBlockNumber()).orElseGet(Instant::now);
            DomainEvent event;
            try {
                event = normalizer.normalize(kind, raw, occurredAt);
            } catch (EventNormalizationException e) {
                reject(kind, raw, e.getMessage());
                return;
            }

            if (!history.record(event)) {
                discardDuplicate(kind, key);
                return;
            }
            log.debug("Recorded {} at {} (tx {})", kind.getEventName(), key, event.getTransactionRef());
            dispatch(event);
        } finally {
            deliveryDepth.get()[0]--;
            if (inFlight.decrementAndGet() == 0 || !running) {
                synchronized (drainMonitor) {
                    drainMonitor.notifyAll();
                }
            }
            stream.lock.unlock();
        }
    }

    private void dispatch(DomainEvent event) {
        for (DomainEventObserver observer : observers.observersOf(event.getKind())) {
            if (!running) {
                log.debug("Synchronizer stopped, skipping remaining observers of {}", event.getSequenceKey());
                return;
            }
            try {
                observer.onEvent(event);
            } catch (Exception e) {
                metrics.recordObserverFailure(event.getKind().getEventName());
                log.warn("Observer failed on {} at {}: {}",
                        event.getKind().getEventName(), event.getSequenceKey(), e.getMessage(), e);
            }
        }
    }

    private void discardDuplicate(DomainEventKind kind, SequenceKey key) {
        metrics.recordDuplicateDiscarded(kind.getEventName());
        log.debug("Discarding duplicate {} at {}", kind.getEventName(), key);
    }

    private void reject(DomainEventKind kind, RawLog raw, String reason) {
        metrics.recordNormalizationFailure(kind.getEventName());
        log.warn("Dropping malformed {} log (block {}, index {}, tx {}): {}",
                kind.getEventName(), raw.getBlockNumber(), raw.getLogIndex(), raw.getTransactionHash(), reason);
    }

    private void awaitDrain() {
        // A delivery on this thread (stop called from an observer) cannot drain itself
        int own = deliveryDepth.get()[0];
        long deadline = System.nanoTime() + stopTimeout.toNanos();
        synchronized (drainMonitor) {
            while (inFlight.get() > own) {
                long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
                if (remainingMs <= 0) {
                    log.warn("Stop timed out after {} ms with {} deliveries in flight",
                            stopTimeout.toMillis(), inFlight.get() - own);
                    return;
                }
                try {
                    drainMonitor.wait(remainingMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting for deliveries to drain");
                    return;
                }
            }
        }
    }

    /**
     * Subscription and serialization state of one event kind.
     */
    private final class KindStream {
        private final DomainEventKind kind;
        private final ReentrantLock lock = new ReentrantLock(true);
        private volatile SynchronizerState state = SynchronizerState.STOPPED;
        private Subscription subscription;

        private KindStream(DomainEventKind kind) {
            this.kind = kind;
        }

        void open() {
            state = SynchronizerState.STARTING;
            try {
                subscription = ledgerClient.onRawLog(kind.getEventName(), raw -> deliver(kind, raw));
                state = SynchronizerState.LISTENING;
            } catch (RuntimeException e) {
                state = SynchronizerState.STOPPED;
                log.error("Could not subscribe to {}: {}", kind.getEventName(), e.getMessage(), e);
            }
        }

        void close() {
            Subscription current = subscription;
            subscription = null;
            if (current != null) {
                try {
                    current.close();
                } catch (RuntimeException e) {
                    log.warn("Unsubscribing from {} failed: {}", kind.getEventName(), e.getMessage());
                }
            }
            state = SynchronizerState.STOPPED;
        }
    }
}
