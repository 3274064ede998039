package com.harvestlink.provenance.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized metrics for provenance operations.
 *
 * Metrics exposed:
 * - provenance.events.received: ledger logs delivered, by kind
 * - provenance.events.duplicates: deliveries discarded as already seen, by kind
 * - provenance.events.rejected: logs that failed normalization, by kind
 * - provenance.observer.failures: observer invocations that threw, by kind
 * - provenance.verifications: verification outcomes, by source and validity
 * - provenance.verification.duration: verification latency
 * - provenance.identifiers.issued: minted identifiers, by kind and nonce assurance
 */
@Component
public class ProvenanceMetrics {

    private final MeterRegistry registry;

    private final Timer verificationTimer;

    public ProvenanceMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.verificationTimer = Timer.builder("provenance.verification.duration")
                .description("Time taken to resolve a verification request")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Event Synchronizer ====================

    public void recordEventReceived(String kind) {
        registry.counter("provenance.events.received", "kind", sanitizeTag(kind)).increment();
    }

    public void recordDuplicateDiscarded(String kind) {
        registry.counter("provenance.events.duplicates", "kind", sanitizeTag(kind)).increment();
    }

    public void recordNormalizationFailure(String kind) {
        registry.counter("provenance.events.rejected", "kind", sanitizeTag(kind)).increment();
    }

    public void recordObserverFailure(String kind) {
        registry.counter("provenance.observer.failures", "kind", sanitizeTag(kind)).increment();
    }

    // ==================== Verification ====================

    public void recordVerification(String sourceOfTruth, boolean valid) {
        registry.counter("provenance.verifications",
                "source", sanitizeTag(sourceOfTruth),
                "valid", String.valueOf(valid)
        ).increment();
    }

    public <T> T timeVerification(Supplier<T> operation) {
        return verificationTimer.record(operation);
    }

    // ==================== Issuance ====================

    public void recordIdentifierIssued(String kind, String assurance) {
        Counter.builder("provenance.identifiers.issued")
                .tag("kind", sanitizeTag(kind))
                .tag("assurance", sanitizeTag(assurance))
                .register(registry)
                .increment();
    }

    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.length() > 64 ? value.substring(0, 64) : value;
    }
}
