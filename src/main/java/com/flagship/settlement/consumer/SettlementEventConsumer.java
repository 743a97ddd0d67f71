package com.flagship.settlement.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.settlement.observability.CorrelationContext;
import com.flagship.settlement.transaction.event.TransactionSucceededEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Consumes settlement events published from the outbox.
 *
 * Offsets are acknowledged manually after processing. An exception leaves the
 * record unacknowledged so it is redelivered; the processed-events table makes
 * the redelivery a no-op once a previous attempt committed.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SettlementEventConsumer {

    static final String CONSUMER_GROUP = "settlement-commission-attribution";

    private final IdempotentEventProcessor eventProcessor;
    private final CommissionAttributionHandler attributionHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.settlement:settlement-events}",
        groupId = "${spring.kafka.consumer.group-id:settlement-core-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parseEnvelope(record);
        if (envelope == null) {
            log.warn("Could not parse event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        MDC.put(CorrelationContext.EVENT_ID_MDC_KEY, envelope.eventId());
        try {
            boolean processed = route(envelope, record.value());
            ack.acknowledge();
            if (processed) {
                log.info("Processed event: type={}, eventId={}, aggregateId={}",
                        envelope.eventType(), envelope.eventId(), envelope.aggregateId());
            }
        } catch (RuntimeException e) {
            log.error("Error processing event {} at offset {}: {}",
                    envelope.eventId(), record.offset(), e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.EVENT_ID_MDC_KEY);
        }
    }

    private boolean route(EventEnvelope envelope, String rawPayload) {
        if (TransactionSucceededEvent.EVENT_TYPE.equals(envelope.eventType())) {
            return eventProcessor.processEvent(
                envelope.eventId(), envelope.eventType(),
                "Transaction", envelope.aggregateId(),
                CONSUMER_GROUP,
                () -> attributionHandler.onTransactionSucceeded(
                    deserialize(rawPayload, TransactionSucceededEvent.class))
            );
        }

        log.debug("Event type {} not handled by {}, skipping", envelope.eventType(), CONSUMER_GROUP);
        eventProcessor.skipEvent(
            envelope.eventId(), envelope.eventType(),
            "Settlement", envelope.aggregateId(),
            CONSUMER_GROUP, "Not relevant to commission attribution"
        );
        return false;
    }

    private EventEnvelope parseEnvelope(ConsumerRecord<String, String> record) {
        try {
            JsonNode node = objectMapper.readTree(record.value());
            JsonNode eventId = node.get("eventId");
            JsonNode eventType = node.get("eventType");
            if (eventId == null || eventType == null) {
                return null;
            }
            return new EventEnvelope(eventId.asText(), record.key(), eventType.asText());
        } catch (JsonProcessingException e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize event: " + e.getMessage(), e);
        }
    }

    private record EventEnvelope(String eventId, String aggregateId, String eventType) {}
}
