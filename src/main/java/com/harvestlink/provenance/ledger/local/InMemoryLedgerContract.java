package com.harvestlink.provenance.ledger.local;

import com.harvestlink.provenance.ledger.Batch;
import com.harvestlink.provenance.ledger.BlockInfo;
import com.harvestlink.provenance.ledger.ContractCall;
import com.harvestlink.provenance.ledger.LedgerContract;
import com.harvestlink.provenance.ledger.LedgerRole;
import com.harvestlink.provenance.ledger.Product;
import com.harvestlink.provenance.ledger.ProductWithHistory;
import com.harvestlink.provenance.ledger.RawLog;
import com.harvestlink.provenance.ledger.Subscription;
import com.harvestlink.provenance.ledger.TransactionRef;
import com.harvestlink.provenance.ledger.exception.TransactionRevertedException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * In-process development ledger.
 *
 * Mirrors the traceability contract closely enough to run the whole service
 * without a chain:
 * 1. Every accepted call mines its own block and emits logs with increasing log indexes
 * 2. Rejected calls complete exceptionally with {@link TransactionRevertedException}
 * 3. Logs are handed to listeners on the delivery executor after state is committed
 *
 * Product and batch ids start at 1, like the deployed contract. Only the most
 * recent logs (the redelivery window) are kept for {@link #redeliverAll()}.
 * Development use only: all other state lives in memory for the life of the
 * process.
 */
@Slf4j
public class InMemoryLedgerContract implements LedgerContract {

    private static final SecureRandom HASH_RANDOM = new SecureRandom();
    public static final int DEFAULT_REDELIVERY_WINDOW = 10_000;

    // Stage codes of the harvest lifecycle table
    static final int STATUS_PACKED = 2;
    static final int STATUS_SHIPPED = 5;
    static final int STATUS_PURCHASED = 7;

    private final Clock clock;
    private final Executor deliveryExecutor;
    private final int redeliveryWindow;

    private final Object stateLock = new Object();
    private final Map<Long, Product> products = new HashMap<>();
    private final Map<Long, List<String>> holders = new HashMap<>();
    private final Map<Long, Batch> batches = new HashMap<>();
    private final Map<Long, Instant> blockTimestamps = new HashMap<>();
    private final Deque<RawLog> emitted = new ArrayDeque<>();
    private long blockNumber;

    private final Map<LedgerRole, Set<String>> roles = new EnumMap<>(LedgerRole.class);
    private final Map<String, List<Consumer<RawLog>>> listeners = new ConcurrentHashMap<>();

    public InMemoryLedgerContract(Clock clock, Executor deliveryExecutor) {
        this(clock, deliveryExecutor, DEFAULT_REDELIVERY_WINDOW);
    }

    public InMemoryLedgerContract(Clock clock, Executor deliveryExecutor, int redeliveryWindow) {
        if (redeliveryWindow < 1) {
            throw new IllegalArgumentException("Redelivery window must be positive: " + redeliveryWindow);
        }
        this.clock = clock;
        this.deliveryExecutor = deliveryExecutor;
        this.redeliveryWindow = redeliveryWindow;
        for (LedgerRole role : LedgerRole.values()) {
            roles.put(role, ConcurrentHashMap.newKeySet());
        }
    }

    public void grantRole(LedgerRole role, String account) {
        roles.get(role).add(normalize(account));
        log.info("Granted {} to {}", role.getRoleId(), account);
    }

    @Override
    public CompletableFuture<TransactionRef> send(ContractCall call, String from) {
        TransactionRef ref;
        try {
            synchronized (stateLock) {
                ref = apply(call, normalize(from));
            }
        } catch (TransactionRevertedException e) {
            log.debug("Call {} from {} reverted: {}", call.functionName(), from, e.getReason());
            return CompletableFuture.failedFuture(e);
        }
        deliver(ref.getLogs());
        return CompletableFuture.completedFuture(ref);
    }

    @Override
    public Optional<Product> products(long id) {
        synchronized (stateLock) {
            return Optional.ofNullable(products.get(id));
        }
    }

    @Override
    public Optional<Batch> batches(long id) {
        synchronized (stateLock) {
            return Optional.ofNullable(batches.get(id));
        }
    }

    @Override
    public Optional<ProductWithHistory> getProductWithHistory(long id) {
        synchronized (stateLock) {
            Product product = products.get(id);
            if (product == null) {
                return Optional.empty();
            }
            return Optional.of(new ProductWithHistory(product, List.copyOf(holders.get(id))));
        }
    }

    @Override
    public long productCount() {
        synchronized (stateLock) {
            return products.size();
        }
    }

    @Override
    public long batchCount() {
        synchronized (stateLock) {
            return batches.size();
        }
    }

    @Override
    public boolean hasRole(LedgerRole role, String account) {
        return account != null && roles.get(role).contains(normalize(account));
    }

    @Override
    public Subscription on(String eventName, Consumer<RawLog> listener) {
        List<Consumer<RawLog>> forEvent = listeners.computeIfAbsent(eventName, k -> new CopyOnWriteArrayList<>());
        forEvent.add(listener);
        return () -> forEvent.remove(listener);
    }

    Optional<BlockInfo> block(long number) {
        synchronized (stateLock) {
            Instant timestamp = blockTimestamps.get(number);
            return timestamp == null ? Optional.empty() : Optional.of(new BlockInfo(number, timestamp));
        }
    }

    /**
     * Delivers the retained logs again, oldest first, the way a provider does
     * after reconnecting.
     */
    public void redeliverAll() {
        List<RawLog> copy;
        synchronized (stateLock) {
            copy = List.copyOf(emitted);
        }
        log.info("Redelivering {} logs", copy.size());
        deliver(copy);
    }

    private TransactionRef apply(ContractCall call, String from) {
        if (call instanceof ContractCall.CreateProduct createProduct) {
            return createProduct(createProduct, from);
        }
        if (call instanceof ContractCall.CreateBatch createBatch) {
            return createBatch(createBatch, from);
        }
        if (call instanceof ContractCall.UpdateBatchLocation update) {
            return updateBatchLocation(update, from);
        }
        if (call instanceof ContractCall.PurchaseBatch purchase) {
            return purchaseBatch(purchase, from);
        }
        throw new TransactionRevertedException("Unsupported call " + call.functionName());
    }

    private TransactionRef createProduct(ContractCall.CreateProduct call, String from) {
        require(roles.get(LedgerRole.FARMER).contains(from), "Caller is not a farmer");

        Block block = nextBlock();
        long id = products.size() + 1L;
        products.put(id, Product.builder()
                .id(id)
                .name(call.name())
                .description(call.description())
                .contentHash(call.contentHash())
                .originator(from)
                .currentHolder(from)
                .priceMinorUnits(call.priceWei())
                .createdAt(block.timestamp)
                .statusCode(0)
                .certificates(List.of())
                .build());
        holders.put(id, new ArrayList<>(List.of(from)));

        block.emit("ProductCreated", BigInteger.valueOf(id), call.name(), from, call.priceWei());
        return block.commit();
    }

    private TransactionRef createBatch(ContractCall.CreateBatch call, String from) {
        Set<Long> ids = new LinkedHashSet<>(call.productIds());
        for (Long productId : ids) {
            Product product = products.get(productId);
            require(product != null, "Product does not exist");
            require(product.getCurrentHolder().equals(from), "Not product owner");
        }

        Block block = nextBlock();
        long id = batches.size() + 1L;
        batches.put(id, Batch.builder()
                .id(id)
                .productIds(Collections.unmodifiableSet(ids))
                .handler(from)
                .createdAt(block.timestamp)
                .location(call.location())
                .statusCode(STATUS_PACKED)
                .build());

        List<BigInteger> idArgs = ids.stream().map(BigInteger::valueOf).toList();
        block.emit("BatchCreated", BigInteger.valueOf(id), idArgs, from, call.location());
        for (Long productId : ids) {
            setStatus(block, productId, STATUS_PACKED, from);
        }
        return block.commit();
    }

    private TransactionRef updateBatchLocation(ContractCall.UpdateBatchLocation call, String from) {
        Batch batch = batches.get(call.batchId());
        require(batch != null, "Batch does not exist");
        require(batch.getHandler().equals(from), "Not batch handler");

        Block block = nextBlock();
        batches.put(batch.getId(), batch.toBuilder().location(call.location()).statusCode(STATUS_SHIPPED).build());
        block.emit("BatchLocationUpdated", BigInteger.valueOf(batch.getId()), call.location(), from);
        return block.commit();
    }

    private TransactionRef purchaseBatch(ContractCall.PurchaseBatch call, String from) {
        Batch batch = batches.get(call.batchId());
        require(batch != null, "Batch does not exist");
        require(batch.getStatusCode() != STATUS_PURCHASED, "Batch already purchased");
        require(!batch.getHandler().equals(from), "Cannot purchase own batch");

        BigInteger total = batch.getProductIds().stream()
                .map(products::get)
                .map(Product::getPriceMinorUnits)
                .reduce(BigInteger.ZERO, BigInteger::add);
        require(call.valueWei().compareTo(total) >= 0, "Insufficient payment");

        Block block = nextBlock();
        String seller = batch.getHandler();
        for (Long productId : batch.getProductIds()) {
            Product product = products.get(productId);
            products.put(productId, product.toBuilder().currentHolder(from).build());
            holders.get(productId).add(from);
            block.emit("OwnershipTransferred", BigInteger.valueOf(productId), product.getCurrentHolder(), from);
            setStatus(block, productId, STATUS_PURCHASED, from);
        }
        batches.put(batch.getId(), batch.toBuilder()
                .handler(from)
                .statusCode(STATUS_PURCHASED)
                .build());
        block.emit("BatchPurchased", BigInteger.valueOf(batch.getId()), from, seller, call.valueWei());
        return block.commit();
    }

    private void setStatus(Block block, long productId, int statusCode, String by) {
        products.computeIfPresent(productId, (k, p) -> p.toBuilder().statusCode(statusCode).build());
        block.emit("StatusUpdated", BigInteger.valueOf(productId), BigInteger.valueOf(statusCode), by);
    }

    private Block nextBlock() {
        return new Block(blockNumber + 1, clock.instant());
    }

    private void deliver(List<RawLog> logs) {
        if (logs.isEmpty()) {
            return;
        }
        deliveryExecutor.execute(() -> {
            for (RawLog rawLog : logs) {
                for (Consumer<RawLog> listener : listeners.getOrDefault(rawLog.getEventName(), List.of())) {
                    try {
                        listener.accept(rawLog);
                    } catch (RuntimeException e) {
                        log.error("Log listener for {} failed", rawLog.getEventName(), e);
                    }
                }
            }
        });
    }

    private static void require(boolean condition, String reason) {
        if (!condition) {
            throw new TransactionRevertedException(reason);
        }
    }

    private static String normalize(String address) {
        return address == null ? null : address.toLowerCase();
    }

    /**
     * Logs of one pending transaction; only becomes visible on commit.
     */
    private final class Block {
        private final long number;
        private final Instant timestamp;
        private final String txHash = "0x" + HexFormat.of().formatHex(randomBytes());
        private final List<RawLog> logs = new ArrayList<>();

        private Block(long number, Instant timestamp) {
            this.number = number;
            this.timestamp = timestamp;
        }

        void emit(String eventName, Object... args) {
            logs.add(new RawLog(eventName, number, logs.size(), txHash, List.of(args)));
        }

        TransactionRef commit() {
            blockNumber = number;
            blockTimestamps.put(number, timestamp);
            emitted.addAll(logs);
            while (emitted.size() > redeliveryWindow) {
                emitted.removeFirst();
            }
            return new TransactionRef(txHash, number, List.copyOf(logs));
        }

        private byte[] randomBytes() {
            byte[] bytes = new byte[32];
            HASH_RANDOM.nextBytes(bytes);
            return bytes;
        }
    }
}
