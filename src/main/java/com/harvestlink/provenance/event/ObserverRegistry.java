package com.harvestlink.provenance.event;

import com.harvestlink.provenance.ledger.Subscription;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Observers by event kind plus wildcard observers.
 *
 * Lists are copy-on-write, so registering or closing during a delivery only
 * affects later deliveries.
 */
class ObserverRegistry {

    private final Map<DomainEventKind, List<DomainEventObserver>> byKind = new EnumMap<>(DomainEventKind.class);
    private final List<DomainEventObserver> wildcard = new CopyOnWriteArrayList<>();

    ObserverRegistry() {
        for (DomainEventKind kind : DomainEventKind.values()) {
            byKind.put(kind, new CopyOnWriteArrayList<>());
        }
    }

    Subscription register(DomainEventKind kind, DomainEventObserver observer) {
        List<DomainEventObserver> target = byKind.get(kind);
        return add(target, observer);
    }

    Subscription registerWildcard(DomainEventObserver observer) {
        return add(wildcard, observer);
    }

    /**
     * Kind observers first, then wildcard observers, in registration order.
     */
    List<DomainEventObserver> observersOf(DomainEventKind kind) {
        List<DomainEventObserver> specific = byKind.get(kind);
        List<DomainEventObserver> all = new ArrayList<>(specific.size() + wildcard.size());
        all.addAll(specific);
        all.addAll(wildcard);
        return all;
    }

    private static Subscription add(List<DomainEventObserver> target, DomainEventObserver observer) {
        if (observer == null) {
            throw new IllegalArgumentException("Observer is required");
        }
        // Wrapped so the same observer can be registered twice and closed independently
        DomainEventObserver registration = observer::onEvent;
        target.add(registration);
        return () -> target.remove(registration);
    }
}
