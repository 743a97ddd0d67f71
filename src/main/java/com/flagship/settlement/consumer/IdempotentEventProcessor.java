package com.flagship.settlement.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Runs an event handler at most once per event and consumer group.
 *
 * The handler and the processed-event record share one transaction. If the
 * handler throws, neither is committed and a redelivery runs the handler
 * again. Two deliveries racing past the existence check both run the handler;
 * the second insert then fails on UNIQUE (event_id, consumer_group) and its
 * transaction rolls back, which is why handlers must themselves be idempotent.
 *
 * <pre>
 * processor.processEvent(eventId, eventType, "Transaction", aggregateId, CONSUMER_GROUP,
 *     () -> handler.onTransactionSucceeded(event));
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * @return true if the handler ran, false if the event was already processed
     */
    @Transactional
    public boolean processEvent(String eventId, String eventType,
                                String aggregateType, String aggregateId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        try {
            handler.run();
        } catch (RuntimeException e) {
            log.error("Failed to process event {} by consumer group {}: {}",
                    eventId, consumerGroup, e.getMessage());
            throw e;
        }

        repository.saveAndFlush(ProcessedEventEntity.fromDomain(ProcessedEvent.success(
            eventId, eventType, aggregateType, aggregateId, consumerGroup)));
        log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
        return true;
    }

    /**
     * Records an event this consumer does not act on, so replays are recognised.
     *
     * @return false if the event was already recorded
     */
    @Transactional
    public boolean skipEvent(String eventId, String eventType,
                             String aggregateType, String aggregateId,
                             String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return false;
        }

        repository.saveAndFlush(ProcessedEventEntity.fromDomain(ProcessedEvent.skipped(
            eventId, eventType, aggregateType, aggregateId, consumerGroup, reason)));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
        return true;
    }

    @Transactional(readOnly = true)
    public boolean isAlreadyProcessed(String eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    @Transactional(readOnly = true)
    public Optional<ProcessedEvent> find(String eventId, String consumerGroup) {
        return repository.findByEventIdAndConsumerGroup(eventId, consumerGroup)
                .map(ProcessedEventEntity::toDomain);
    }
}
