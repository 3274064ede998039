package com.harvestlink.provenance.observability;

import com.harvestlink.provenance.event.DomainEventKind;
import com.harvestlink.provenance.event.EventSynchronizer;
import com.harvestlink.provenance.event.SynchronizerState;
import com.harvestlink.provenance.ledger.LedgerClient;
import com.harvestlink.provenance.ledger.WalletProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Custom health indicators for the provenance verifier.
 */
public class HealthIndicators {

    /**
     * Up while every event kind is listening. A stopped synchronizer is
     * reported as OUT_OF_SERVICE; a partially subscribed one as DEGRADED,
     * since verification still works from ledger state.
     */
    @Component("synchronizerHealth")
    public static class SynchronizerHealthIndicator implements HealthIndicator {

        private final EventSynchronizer synchronizer;

        public SynchronizerHealthIndicator(EventSynchronizer synchronizer) {
            this.synchronizer = synchronizer;
        }

        @Override
        public Health health() {
            Map<DomainEventKind, SynchronizerState> states = synchronizer.getStates();
            long listening = states.values().stream()
                    .filter(state -> state == SynchronizerState.LISTENING)
                    .count();

            Health.Builder builder = !synchronizer.isRunning()
                    ? Health.outOfService()
                    : listening == states.size()
                    ? Health.up()
                    : Health.status("DEGRADED");

            return builder
                    .withDetail("states", states)
                    .withDetail("retainedEvents", synchronizer.history().size())
                    .build();
        }
    }

    /**
     * Health indicator for the wallet provider and ledger connection.
     */
    @Component("ledgerHealth")
    public static class LedgerHealthIndicator implements HealthIndicator {

        private final WalletProvider walletProvider;
        private final LedgerClient ledgerClient;

        public LedgerHealthIndicator(WalletProvider walletProvider, LedgerClient ledgerClient) {
            this.walletProvider = walletProvider;
            this.ledgerClient = ledgerClient;
        }

        @Override
        public Health health() {
            try {
                if (!walletProvider.isAvailable()) {
                    return Health.down()
                            .withDetail("error", "No wallet provider detected")
                            .build();
                }
                Health.Builder builder = Health.up()
                        .withDetail("bound", ledgerClient.isBound());
                ledgerClient.getConnectedAccount()
                        .ifPresent(account -> builder.withDetail("account", account.getAddress()));
                return builder.build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
