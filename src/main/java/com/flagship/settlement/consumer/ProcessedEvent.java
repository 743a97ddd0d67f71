package com.flagship.settlement.consumer;

import lombok.Value;

import java.time.Instant;

/**
 * Record that a consumer group has handled an event.
 *
 * Event ids are strings so the same table deduplicates both outbox events
 * (UUIDs) and payment provider webhook deliveries ({@code evt_...} ids).
 */
@Value
public class ProcessedEvent {
    String eventId;
    String eventType;
    String aggregateType;
    String aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String note;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED
    }

    public static ProcessedEvent success(String eventId, String eventType,
                                         String aggregateType, String aggregateId,
                                         String consumerGroup) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId,
            consumerGroup, Instant.now(), ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(String eventId, String eventType,
                                         String aggregateType, String aggregateId,
                                         String consumerGroup, String reason) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId,
            consumerGroup, Instant.now(), ProcessingResult.SKIPPED, reason);
    }
}
