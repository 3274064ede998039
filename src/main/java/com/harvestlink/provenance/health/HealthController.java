package com.harvestlink.provenance.health;

import com.harvestlink.provenance.event.DomainEventKind;
import com.harvestlink.provenance.event.EventSynchronizer;
import com.harvestlink.provenance.event.SynchronizerState;
import com.harvestlink.provenance.ledger.LedgerClient;
import com.harvestlink.provenance.ledger.WalletProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Readiness of the verification service for orchestrators and load balancers.
 *
 * Status rules:
 * 1. DOWN (503) when the off-chain store is unreachable or the synchronizer
 *    is stopped; public batch scans cannot be answered correctly then
 * 2. DEGRADED (200) when some event kinds are not listening or no wallet
 *    provider is present; scans are answered but confirmations may lag
 * 3. UP otherwise
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    static final String DEGRADED = "DEGRADED";

    private final DataSource dataSource;
    private final EventSynchronizer synchronizer;
    private final WalletProvider walletProvider;
    private final LedgerClient ledgerClient;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean storeUp = offChainStoreReachable();
        boolean running = synchronizer.isRunning();
        List<String> notListening = synchronizer.getStates().entrySet().stream()
                .filter(entry -> entry.getValue() != SynchronizerState.LISTENING)
                .map(Map.Entry::getKey)
                .map(DomainEventKind::getEventName)
                .sorted()
                .toList();
        boolean walletUp = walletAvailable();

        String status;
        if (!storeUp || !running) {
            status = "DOWN";
        } else if (!notListening.isEmpty() || !walletUp) {
            status = DEGRADED;
        } else {
            status = "UP";
        }

        Map<String, Object> events = new LinkedHashMap<>();
        events.put("running", running);
        events.put("notListening", notListening);
        events.put("retainedEvents", synchronizer.history().size());

        Map<String, Object> ledger = new LinkedHashMap<>();
        ledger.put("walletAvailable", walletUp);
        ledger.put("bound", ledgerClient.isBound());
        ledgerClient.getConnectedAccount().ifPresent(account -> ledger.put("account", account.getAddress()));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", status);
        response.put("timestamp", Instant.now().toString());
        response.put("offChainStore", storeUp ? "UP" : "DOWN");
        response.put("events", events);
        response.put("ledger", ledger);

        if ("DOWN".equals(status)) {
            log.warn("Readiness DOWN: offChainStore={}, synchronizerRunning={}", storeUp, running);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }
        return ResponseEntity.ok(response);
    }

    private boolean offChainStoreReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Off-chain store unreachable: {}", e.getMessage());
            return false;
        }
    }

    private boolean walletAvailable() {
        try {
            return walletProvider.isAvailable();
        } catch (RuntimeException e) {
            log.warn("Wallet provider check failed: {}", e.getMessage());
            return false;
        }
    }
}
