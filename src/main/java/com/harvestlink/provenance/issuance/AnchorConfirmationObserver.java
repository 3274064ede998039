package com.harvestlink.provenance.issuance;

import com.harvestlink.provenance.event.DomainEvent;
import com.harvestlink.provenance.event.DomainEventObserver;
import com.harvestlink.provenance.event.EventSynchronizer;
import com.harvestlink.provenance.ledger.Subscription;
import com.harvestlink.provenance.offchain.OffChainDataStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Confirms anchoring records whose transaction has been mirrored from the ledger.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnchorConfirmationObserver implements DomainEventObserver {

    private final EventSynchronizer synchronizer;
    private final OffChainDataStore offChainDataStore;

    // One transaction emits several logs; confirming once is enough
    private volatile String lastConfirmedTransaction;

    private Subscription subscription;

    @PostConstruct
    void register() {
        subscription = synchronizer.subscribeAll(this);
    }

    @PreDestroy
    void unregister() {
        if (subscription != null) {
            subscription.close();
        }
    }

    @Override
    public void onEvent(DomainEvent event) {
        String tx = event.getTransactionRef();
        if (tx.equalsIgnoreCase(lastConfirmedTransaction)) {
            return;
        }
        int confirmed = offChainDataStore.confirmAnchors(tx);
        lastConfirmedTransaction = tx;
        if (confirmed > 0) {
            log.debug("Event {} confirmed {} anchor(s) of tx {}", event.getSequenceKey(), confirmed, tx);
        }
    }
}
