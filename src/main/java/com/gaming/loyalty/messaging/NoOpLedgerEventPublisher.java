package com.gaming.loyalty.messaging;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Publisher used when Kafka is disabled. Events are only logged at debug level.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "loyalty.kafka.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpLedgerEventPublisher implements LedgerEventPublisher {

    @Override
    public void publish(LedgerEvent event) {
        log.debug("Ledger event not published (Kafka disabled): type={}, playerId={}", event.getEventType(), event.getPlayerId());
    }
}
