package com.harvestlink.provenance.event;

/**
 * Receives mirrored events synchronously on the delivering thread.
 */
@FunctionalInterface
public interface DomainEventObserver {

    void onEvent(DomainEvent event);
}
