package com.flagship.settlement.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.settlement.consumer.IdempotentEventProcessor;
import com.flagship.settlement.observability.CorrelationContext;
import com.flagship.settlement.observability.SettlementMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for payment provider webhooks.
 *
 * Only a bad signature is reported back as an error. Every verified delivery
 * is acknowledged, whatever happens while applying it, so the provider stops
 * retrying; failures are logged and counted for operator follow-up.
 * Deliveries are deduplicated by provider event id.
 *
 * Not transactional itself: each event is applied in the transaction opened
 * by {@link IdempotentEventProcessor}, which has already rolled back by the
 * time a handler failure reaches this class.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookReconciler {

    static final String CONSUMER_GROUP = "payment-provider-webhooks";
    private static final String AGGREGATE_TYPE = "ProviderEvent";

    private final WebhookSignatureVerifier signatureVerifier;
    private final WebhookHandlerRegistry handlerRegistry;
    private final IdempotentEventProcessor eventProcessor;
    private final ObjectMapper objectMapper;
    private final SettlementMetrics metrics;

    /**
     * @throws com.flagship.settlement.exception.InvalidSignatureException when the signature does not verify
     */
    public WebhookReceipt reconcile(String payload, String signatureHeader) {
        signatureVerifier.verify(payload, signatureHeader);

        ProviderEvent event;
        try {
            event = ProviderEvent.fromJson(objectMapper.readTree(payload));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Acknowledging verified webhook with unparseable envelope: {}", e.getMessage());
            metrics.recordWebhook("unknown", WebhookOutcome.UNPARSEABLE.code());
            return new WebhookReceipt(null, null, WebhookOutcome.UNPARSEABLE);
        }

        MDC.put(CorrelationContext.EVENT_ID_MDC_KEY, event.getId());
        try {
            WebhookOutcome outcome = apply(event);
            metrics.recordWebhook(event.getType(), outcome.code());
            return new WebhookReceipt(event.getId(), event.getType(), outcome);
        } finally {
            MDC.remove(CorrelationContext.EVENT_ID_MDC_KEY);
        }
    }

    private WebhookOutcome apply(ProviderEvent event) {
        Optional<WebhookEventHandler> handler = handlerRegistry.find(event.getType());

        try {
            if (handler.isEmpty()) {
                boolean recorded = eventProcessor.skipEvent(event.getId(), event.getType(),
                    AGGREGATE_TYPE, event.getObjectId(), CONSUMER_GROUP, "No handler for event type");
                if (!recorded) {
                    log.info("Duplicate delivery of unhandled event {} ({})", event.getId(), event.getType());
                    return WebhookOutcome.DUPLICATE;
                }
                log.info("Acknowledged unhandled event type {} ({})", event.getType(), event.getId());
                return WebhookOutcome.UNHANDLED;
            }

            boolean processed = eventProcessor.processEvent(event.getId(), event.getType(),
                AGGREGATE_TYPE, event.getObjectId(), CONSUMER_GROUP, () -> handler.get().handle(event));
            if (!processed) {
                log.info("Duplicate delivery of event {} ({}), already applied", event.getId(), event.getType());
                return WebhookOutcome.DUPLICATE;
            }
            log.info("Applied event {} ({})", event.getId(), event.getType());
            return WebhookOutcome.APPLIED;

        } catch (DataIntegrityViolationException e) {
            if (eventProcessor.isAlreadyProcessed(event.getId(), CONSUMER_GROUP)) {
                log.info("Event {} ({}) was recorded by a concurrent delivery", event.getId(), event.getType());
                return WebhookOutcome.DUPLICATE;
            }
            log.error("Failed to apply event {} ({}) on a constraint violation, acknowledging for manual follow-up: {}",
                event.getId(), event.getType(), e.getMessage(), e);
            return WebhookOutcome.FAILED;
        } catch (RuntimeException e) {
            log.error("Failed to apply event {} ({}), acknowledging for manual follow-up: {}",
                event.getId(), event.getType(), e.getMessage(), e);
            return WebhookOutcome.FAILED;
        }
    }
}
