package com.harvestlink.provenance.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harvestlink.provenance.event.payload.EventPayload;
import com.harvestlink.provenance.ledger.Subscription;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Publishes every mirrored event to Kafka for downstream consumers.
 *
 * Keyed by sequence key, so a redelivered ledger log maps to the same record
 * key. Sends are asynchronous; a failed send is logged and not retried, since
 * the ledger remains the source of truth.
 */
@Component
@ConditionalOnProperty(name = "provenance.kafka.relay.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class KafkaDomainEventRelay implements DomainEventObserver {

    private final EventSynchronizer synchronizer;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    @Value("${provenance.kafka.topic:provenance-events}")
    private String topic;

    private Subscription subscription;

    @PostConstruct
    void register() {
        subscription = synchronizer.subscribeAll(this);
        log.info("Relaying provenance events to Kafka topic {}", topic);
    }

    @PreDestroy
    void unregister() {
        if (subscription != null) {
            subscription.close();
        }
    }

    @Override
    public void onEvent(DomainEvent event) {
        String key = event.getSequenceKey().toString();
        String value;
        try {
            value = objectMapper.writeValueAsString(EventMessage.of(event));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} at {}", event.getKind(), key, e);
            return;
        }

        kafkaTemplate.send(topic, key, value).whenComplete((result, error) -> {
            if (error != null) {
                log.error("Failed to relay event: key={}, kind={}, error={}",
                        key, event.getKind().getEventName(), error.getMessage());
            } else {
                log.debug("Relayed event: key={}, partition={}, offset={}",
                        key, result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
            }
        });
    }

    /**
     * Wire format of a relayed event.
     */
    record EventMessage(String kind, long blockNumber, int logIndex, String transactionHash,
                        Instant occurredAt, EventPayload payload) {

        static EventMessage of(DomainEvent event) {
            return new EventMessage(
                    event.getKind().getEventName(),
                    event.getSequenceKey().blockNumber(),
                    event.getSequenceKey().logIndex(),
                    event.getTransactionRef(),
                    event.getOccurredAt(),
                    event.getPayload());
        }
    }
}
