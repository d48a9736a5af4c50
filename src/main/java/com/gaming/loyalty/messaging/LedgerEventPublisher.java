package com.gaming.loyalty.messaging;

/**
 * Publishes ledger events. Callers hand events over only after the database transaction that produced
 * them has committed.
 */
public interface LedgerEventPublisher {

    void publish(LedgerEvent event);
}
