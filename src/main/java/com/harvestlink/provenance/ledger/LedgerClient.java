package com.harvestlink.provenance.ledger;

import com.harvestlink.provenance.ledger.exception.LedgerException;
import com.harvestlink.provenance.ledger.exception.LedgerRecordNotFoundException;
import com.harvestlink.provenance.ledger.exception.NoAccountsException;
import com.harvestlink.provenance.ledger.exception.ProviderUnavailableException;
import com.harvestlink.provenance.ledger.exception.TransactionTimeoutException;
import com.harvestlink.provenance.ledger.exception.UserRejectedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Client for the append-only ledger.
 *
 * Holds exactly one contract binding, created lazily on first use and shared
 * by every caller. Reads may run concurrently. Submissions are queued one at
 * a time, since a wallet session can only have one pending confirmation.
 *
 * Error policy:
 * - connect/submit failures are thrown as {@link LedgerException}s, the caller must retry or approve
 * - role checks are advisory: a missing role is logged, never thrown
 */
@Service
@Slf4j
public class LedgerClient {

    private final WalletProvider walletProvider;
    private final LedgerContractBinder contractBinder;
    private final Duration submitTimeout;

    private final ReentrantLock submitLock = new ReentrantLock(true);
    private final AtomicReference<AccountHandle> account = new AtomicReference<>();
    private volatile LedgerContract contract;

    public LedgerClient(WalletProvider walletProvider,
                        LedgerContractBinder contractBinder,
                        @Value("${provenance.ledger.submit-timeout-ms:60000}") long submitTimeoutMs) {
        this.walletProvider = walletProvider;
        this.contractBinder = contractBinder;
        this.submitTimeout = Duration.ofMillis(submitTimeoutMs);
    }

    /**
     * Requests account access from the wallet.
     *
     * @throws ProviderUnavailableException if no wallet is present or it fails to answer
     * @throws UserRejectedException if the holder declines
     * @throws NoAccountsException if the wallet returns no accounts
     */
    public AccountHandle connect() {
        if (!walletProvider.isAvailable()) {
            throw new ProviderUnavailableException(
                "No wallet provider detected. Install a wallet and retry.");
        }

        List<String> accounts;
        try {
            accounts = walletProvider.requestAccounts();
        } catch (LedgerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderUnavailableException("Failed to request accounts: " + e.getMessage(), e);
        }

        if (accounts == null || accounts.isEmpty()) {
            throw new NoAccountsException();
        }

        AccountHandle handle = new AccountHandle(accounts.get(0), Instant.now());
        account.set(handle);
        log.info("Connected ledger account {}", handle.getAddress());

        checkRoleAdvisory(LedgerRole.FARMER, handle.getAddress());
        return handle;
    }

    /**
     * The account the wallet already authorized, if any. Does not prompt.
     */
    public Optional<String> currentAccount() {
        try {
            List<String> accounts = walletProvider.listAccounts();
            return accounts == null || accounts.isEmpty() ? Optional.empty() : Optional.of(accounts.get(0));
        } catch (RuntimeException e) {
            log.warn("Could not list wallet accounts: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Submits a state-changing call and blocks until it is included.
     *
     * @throws com.harvestlink.provenance.ledger.exception.TransactionRevertedException on contract rejection
     * @throws TransactionTimeoutException if inclusion takes longer than the configured bound
     */
    public TransactionRef submit(ContractCall call) {
        submitLock.lock();
        try {
            AccountHandle from = account.get();
            if (from == null) {
                from = connect();
            }

            log.info("Submitting {} from {}", call.functionName(), from.getAddress());
            CompletableFuture<TransactionRef> pending = contract().send(call, from.getAddress());
            TransactionRef ref = awaitInclusion(call, pending);
            log.info("Transaction {} included: hash={}, block={}",
                    call.functionName(), ref.getHash(), ref.getBlockNumber());
            return ref;
        } finally {
            submitLock.unlock();
        }
    }

    public Product readProduct(long id) {
        return contract().products(id)
                .orElseThrow(() -> new LedgerRecordNotFoundException("Product", id));
    }

    public Batch readBatch(long id) {
        return contract().batches(id)
                .orElseThrow(() -> new LedgerRecordNotFoundException("Batch", id));
    }

    public ProductWithHistory readProductWithHistory(long id) {
        return contract().getProductWithHistory(id)
                .orElseThrow(() -> new LedgerRecordNotFoundException("Product", id));
    }

    public long productCount() {
        return contract().productCount();
    }

    public long batchCount() {
        return contract().batchCount();
    }

    /**
     * Advisory role check. The ledger enforces authorization itself.
     */
    public boolean hasRole(LedgerRole role, String address) {
        return contract().hasRole(role, address);
    }

    /**
     * Block timestamp as reported by the wallet provider.
     */
    public Optional<Instant> blockTimestamp(long blockNumber) {
        try {
            return walletProvider.getBlock(blockNumber).map(BlockInfo::getTimestamp);
        } catch (RuntimeException e) {
            log.debug("Block {} lookup failed: {}", blockNumber, e.getMessage());
            return Optional.empty();
        }
    }

    public Subscription onRawLog(String eventName, Consumer<RawLog> listener) {
        return contract().on(eventName, listener);
    }

    public Optional<AccountHandle> getConnectedAccount() {
        return Optional.ofNullable(account.get());
    }

    public boolean isBound() {
        return contract != null;
    }

    private LedgerContract contract() {
        LedgerContract bound = contract;
        if (bound == null) {
            synchronized (this) {
                bound = contract;
                if (bound == null) {
                    if (!walletProvider.isAvailable()) {
                        throw new ProviderUnavailableException(
                            "No wallet provider detected. Install a wallet and retry.");
                    }
                    bound = contractBinder.bind(walletProvider);
                    contract = bound;
                    log.info("Ledger contract binding created");
                }
            }
        }
        return bound;
    }

    private TransactionRef awaitInclusion(ContractCall call, CompletableFuture<TransactionRef> pending) {
        try {
            return pending.get(submitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Transaction {} not included within {} ms", call.functionName(), submitTimeout.toMillis());
            throw new TransactionTimeoutException(call.functionName(), submitTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException("Interrupted while waiting for " + call.functionName(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof LedgerException ledgerException) {
                log.warn("Transaction {} failed: {}", call.functionName(), ledgerException.getMessage());
                throw ledgerException;
            }
            throw new ProviderUnavailableException(
                "Transaction " + call.functionName() + " failed: " + cause.getMessage(), cause);
        }
    }

    private void checkRoleAdvisory(LedgerRole role, String address) {
        try {
            if (!hasRole(role, address)) {
                log.warn("Connected account {} lacks {}. Some ledger actions may be restricted.",
                        address, role.getRoleId());
            }
        } catch (RuntimeException e) {
            log.warn("Role check skipped due to contract/provider issue: {}", e.getMessage());
        }
    }
}
