package com.harvestlink.provenance.ledger;

/**
 * Handle for a registered listener. Closing it removes the listener;
 * closing twice is a no-op.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
