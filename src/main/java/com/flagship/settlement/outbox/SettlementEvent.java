package com.flagship.settlement.outbox;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of every event written to the outbox.
 *
 * The serialized payload always carries {@code eventId} and {@code eventType},
 * which consumers use for routing and deduplication.
 */
public interface SettlementEvent {

    UUID getEventId();

    Instant getOccurredAt();

    String getEventType();
}
