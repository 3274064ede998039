package com.harvestlink.provenance.event;

import com.harvestlink.provenance.event.payload.BatchLocationUpdatedPayload;
import com.harvestlink.provenance.ledger.LedgerClient;
import com.harvestlink.provenance.ledger.RawLog;
import com.harvestlink.provenance.ledger.Subscription;
import com.harvestlink.provenance.observability.ProvenanceMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Event synchronizer tests.
 *
 * These tests verify that:
 * - Redelivered logs are recorded and observed once
 * - Malformed logs are dropped without stopping the stream
 * - A failing observer does not block other observers
 * - Deliveries of one kind never overlap
 * - No observer runs after stop() returns, and stop() waits for in-flight deliveries
 */
class EventSynchronizerTest {

    private static final Instant MINED = Instant.parse("2024-04-10T06:00:00Z");

    private final Map<String, Consumer<RawLog>> listeners = new ConcurrentHashMap<>();
    private SimpleMeterRegistry registry;
    private EventSynchronizer synchronizer;

    @BeforeEach
    void setUp() {
        LedgerClient ledgerClient = mock(LedgerClient.class);
        when(ledgerClient.onRawLog(anyString(), any())).thenAnswer(invocation -> {
            String name = invocation.getArgument(0);
            Consumer<RawLog> listener = invocation.getArgument(1);
            listeners.put(name, listener);
            return (Subscription) () -> listeners.remove(name, listener);
        });
        when(ledgerClient.blockTimestamp(anyLong())).thenReturn(Optional.of(MINED));

        registry = new SimpleMeterRegistry();
        synchronizer = new EventSynchronizer(ledgerClient, new EventNormalizer(),
                new ProvenanceMetrics(registry), 100, 2_000, true);
        synchronizer.start();
    }

    @AfterEach
    void tearDown() {
        synchronizer.stop();
    }

    private static RawLog locationLog(long block, int index, long batchId, String location) {
        return new RawLog("BatchLocationUpdated", block, index, "0xtx" + block,
                List.of(BigInteger.valueOf(batchId), location, "0xhandler"));
    }

    private void emit(RawLog raw) {
        Consumer<RawLog> listener = listeners.get(raw.getEventName());
        if (listener != null) {
            listener.accept(raw);
        }
    }

    private double counter(String name) {
        return registry.find(name).counters().stream().mapToDouble(c -> c.count()).sum();
    }

    @Nested
    @DisplayName("1. Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("1.1 Start listens on every kind, stop releases every subscription")
        void startStop() {
            assertTrue(synchronizer.isRunning());
            assertEquals(DomainEventKind.values().length, listeners.size());
            synchronizer.getStates().values().forEach(state -> assertEquals(SynchronizerState.LISTENING, state));

            synchronizer.stop();

            assertFalse(synchronizer.isRunning());
            assertTrue(listeners.isEmpty());
            assertEquals(SynchronizerState.STOPPED, synchronizer.getState(DomainEventKind.BATCH_PURCHASED));
        }

        @Test
        @DisplayName("1.2 Start and stop are idempotent")
        void idempotent() {
            synchronizer.start();
            assertEquals(DomainEventKind.values().length, listeners.size());

            synchronizer.stop();
            synchronizer.stop();
            assertFalse(synchronizer.isRunning());
        }

        @Test
        @DisplayName("1.3 Unknown event names cannot be subscribed to")
        void unknownEventName() {
            assertThrows(IllegalArgumentException.class, () -> synchronizer.subscribe("Transfer", event -> { }));
        }
    }

    @Nested
    @DisplayName("2. Delivery")
    class Delivery {

        @Test
        @DisplayName("2.1 Same (block, logIndex) delivered twice is recorded and observed once")
        void deduplicates() {
            List<DomainEvent> seen = new ArrayList<>();
            synchronizer.subscribe(DomainEventKind.BATCH_LOCATION_UPDATED, seen::add);

            emit(locationLog(100, 0, 1, "Pune"));
            emit(locationLog(100, 0, 1, "Pune"));
            emit(locationLog(100, 1, 1, "Mumbai"));

            assertEquals(2, synchronizer.history().size());
            assertEquals(2, seen.size());
            assertEquals(1.0, counter("provenance.events.duplicates"));
            assertEquals(new SequenceKey(100, 1), synchronizer.history().get(0).getSequenceKey());
        }

        @Test
        @DisplayName("2.2 Events carry the block timestamp")
        void blockTime() {
            emit(locationLog(5, 0, 1, "Pune"));

            assertEquals(MINED, synchronizer.history().get(0).getOccurredAt());
        }

        @Test
        @DisplayName("2.3 Malformed logs are dropped and later logs still flow")
        void malformedDropped() {
            emit(new RawLog("BatchLocationUpdated", 1, 0, "0xbad", List.of("not-a-number", "Pune", "0xa")));
            emit(locationLog(2, 0, 1, "Pune"));

            assertEquals(1, synchronizer.history().size());
            assertEquals(1.0, counter("provenance.events.rejected"));
        }

        @Test
        @DisplayName("2.4 Failing observer does not block the others")
        void failingObserver() {
            AtomicInteger calls = new AtomicInteger();
            synchronizer.subscribe(DomainEventKind.BATCH_LOCATION_UPDATED, event -> {
                throw new IllegalStateException("observer bug");
            });
            synchronizer.subscribe(DomainEventKind.BATCH_LOCATION_UPDATED, event -> calls.incrementAndGet());
            synchronizer.subscribeAll(event -> calls.incrementAndGet());

            emit(locationLog(3, 0, 1, "Pune"));

            assertEquals(2, calls.get());
            assertEquals(1.0, counter("provenance.observer.failures"));
        }

        @Test
        @DisplayName("2.5 Kind observers run before wildcard observers")
        void observerOrder() {
            List<String> order = Collections.synchronizedList(new ArrayList<>());
            synchronizer.subscribe("*", event -> order.add("wildcard"));
            synchronizer.subscribe("BatchLocationUpdated", event -> order.add("kind"));

            emit(locationLog(3, 0, 1, "Pune"));

            assertEquals(List.of("kind", "wildcard"), order);
        }

        @Test
        @DisplayName("2.6 Closed subscriptions stop receiving")
        void closedSubscription() {
            AtomicInteger calls = new AtomicInteger();
            Subscription subscription = synchronizer.subscribeAll(event -> calls.incrementAndGet());

            emit(locationLog(1, 0, 1, "Pune"));
            subscription.close();
            emit(locationLog(2, 0, 1, "Mumbai"));

            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("2.7 Batch history filters by payload")
        void batchHistory() {
            emit(locationLog(1, 0, 1, "Pune"));
            emit(locationLog(2, 0, 2, "Nagpur"));
            emit(locationLog(3, 0, 1, "Mumbai"));

            List<DomainEvent> batchOne = synchronizer.batchHistory(1);
            assertEquals(2, batchOne.size());
            assertEquals("Mumbai", ((BatchLocationUpdatedPayload) batchOne.get(0).getPayload()).location());
            assertTrue(synchronizer.productHistory(1).isEmpty());
            assertTrue(synchronizer.findByTransactionRef("0XTX2").isPresent());
        }
    }

    @Nested
    @DisplayName("3. Concurrency and shutdown")
    class Shutdown {

        @Test
        @DisplayName("3.1 Deliveries after stop invoke no observer")
        void noDeliveryAfterStop() {
            AtomicInteger calls = new AtomicInteger();
            synchronizer.subscribeAll(event -> calls.incrementAndGet());

            synchronizer.stop();
            synchronizer.deliver(DomainEventKind.BATCH_LOCATION_UPDATED, locationLog(9, 0, 1, "Pune"));

            assertEquals(0, calls.get());
            assertTrue(synchronizer.history().isEmpty());
        }

        @Test
        @DisplayName("3.2 Stop called from inside an observer returns and skips later observers")
        void stopFromObserver() {
            AtomicInteger later = new AtomicInteger();
            synchronizer.subscribe(DomainEventKind.BATCH_LOCATION_UPDATED, event -> synchronizer.stop());
            synchronizer.subscribeAll(event -> later.incrementAndGet());

            assertTimeoutPreemptively(java.time.Duration.ofSeconds(2),
                    () -> emit(locationLog(1, 0, 1, "Pune")));

            assertFalse(synchronizer.isRunning());
            assertEquals(0, later.get());
        }

        @Test
        @DisplayName("3.3 Stop waits for an in-flight delivery to finish")
        void stopDrains() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            synchronizer.subscribeAll(event -> {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });

            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                executor.submit(() -> emit(locationLog(1, 0, 1, "Pune")));
                assertTrue(entered.await(2, TimeUnit.SECONDS));

                AtomicBoolean stopped = new AtomicBoolean();
                executor.submit(() -> {
                    synchronizer.stop();
                    stopped.set(true);
                });
                Thread.sleep(200);
                assertFalse(stopped.get(), "stop() returned while an observer was still running");

                release.countDown();
                executor.shutdown();
                assertTrue(executor.awaitTermination(3, TimeUnit.SECONDS));
                assertTrue(stopped.get());
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("3.4 Deliveries of one kind never overlap")
        void serializedPerKind() throws Exception {
            AtomicInteger active = new AtomicInteger();
            AtomicInteger maxActive = new AtomicInteger();
            synchronizer.subscribe(DomainEventKind.BATCH_LOCATION_UPDATED, event -> {
                int now = active.incrementAndGet();
                maxActive.accumulateAndGet(now, Math::max);
                try {
                    Thread.sleep(2);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                active.decrementAndGet();
            });

            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                for (int t = 0; t < threads; t++) {
                    int block = t;
                    executor.submit(() -> {
                        start.await();
                        for (int i = 0; i < 10; i++) {
                            emit(locationLog(block, i, 1, "Pune"));
                            // every other thread redelivers its previous log
                            if (block % 2 == 0 && i > 0) {
                                emit(locationLog(block, i - 1, 1, "Pune"));
                            }
                        }
                        return null;
                    });
                }
                start.countDown();
                executor.shutdown();
                assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }

            assertEquals(1, maxActive.get());
            assertEquals(threads * 10, synchronizer.history().size());
        }
    }
}
