package com.harvestlink.provenance.ledger;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Binding to the deployed traceability contract.
 *
 * Reads return empty for ids that were never created. Sends complete once
 * the transaction is included, or exceptionally with a
 * {@link com.harvestlink.provenance.ledger.exception.LedgerException}.
 */
public interface LedgerContract {

    CompletableFuture<TransactionRef> send(ContractCall call, String from);

    Optional<Product> products(long id);

    Optional<Batch> batches(long id);

    Optional<ProductWithHistory> getProductWithHistory(long id);

    long productCount();

    long batchCount();

    boolean hasRole(LedgerRole role, String account);

    /**
     * Registers a listener for one contract event. Providers may redeliver
     * logs, for instance after reconnecting.
     */
    Subscription on(String eventName, Consumer<RawLog> listener);
}
