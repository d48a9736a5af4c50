package com.gaming.loyalty.messaging;

import com.gaming.loyalty.config.LoyaltyProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes ledger events to Kafka, keyed by player id so one player's events stay ordered
 * within a partition. Send failures are logged; the ledger tables remain the source of truth.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "loyalty.kafka.enabled", havingValue = "true")
public class KafkaLedgerEventPublisher implements LedgerEventPublisher {

    private final KafkaTemplate<String, LedgerEvent> ledgerEventKafkaTemplate;
    private final LoyaltyProperties properties;

    @Override
    public void publish(LedgerEvent event) {
        String topic = properties.getKafka().getLedgerTopic();
        String key = event.getPlayerId();
        log.debug("Publishing ledger event: key={}, eventId={}, eventType={}", key, event.getEventId(), event.getEventType());
        CompletableFuture<SendResult<String, LedgerEvent>> future;
        try {
            future = ledgerEventKafkaTemplate.send(topic, key, event);
        } catch (RuntimeException e) {
            log.error("Failed to send ledger event key={} eventId={}", key, event.getEventId(), e);
            return;
        }
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish ledger event key={} eventId={}", key, event.getEventId(), ex);
            } else {
                log.debug("Published ledger event: key={}, eventId={}, partition={}, offset={}",
                        key, event.getEventId(),
                        result != null ? result.getRecordMetadata().partition() : null,
                        result != null ? result.getRecordMetadata().offset() : null);
            }
        });
    }
}
