package com.flagship.settlement.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.settlement.consumer.IdempotentEventProcessor;
import com.flagship.settlement.exception.InvalidSignatureException;
import com.flagship.settlement.observability.SettlementMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebhookReconcilerTest {

    private static final String SIGNATURE = "t=1,v1=abc";

    @Mock
    private WebhookSignatureVerifier signatureVerifier;
    @Mock
    private IdempotentEventProcessor eventProcessor;

    private final List<ProviderEvent> handled = new ArrayList<>();
    private SimpleMeterRegistry registry;
    private WebhookReconciler reconciler;
    private RuntimeException handlerFailure;

    @BeforeEach
    void setUp() {
        WebhookEventHandler paymentHandler = new WebhookEventHandler() {
            @Override
            public Set<String> supportedEventTypes() {
                return Set.of("payment_intent.succeeded");
            }

            @Override
            public void handle(ProviderEvent event) {
                if (handlerFailure != null) {
                    throw handlerFailure;
                }
                handled.add(event);
            }
        };
        registry = new SimpleMeterRegistry();
        reconciler = new WebhookReconciler(signatureVerifier, new WebhookHandlerRegistry(List.of(paymentHandler)),
                eventProcessor, new ObjectMapper(), new SettlementMetrics(registry));
    }

    @Test
    @DisplayName("First delivery is applied through the handler")
    void appliesNewEvent() {
        runHandlerWhenProcessed();

        WebhookReceipt receipt = reconciler.reconcile(event("evt_1", "payment_intent.succeeded"), SIGNATURE);

        assertEquals(WebhookOutcome.APPLIED, receipt.getOutcome());
        assertEquals("evt_1", receipt.getEventId());
        assertEquals(1, handled.size());
        assertEquals("pi_1", handled.get(0).getObjectId());
        verify(eventProcessor).processEvent(eq("evt_1"), eq("payment_intent.succeeded"), eq("ProviderEvent"),
                eq("pi_1"), eq(WebhookReconciler.CONSUMER_GROUP), any());
        assertEquals(1.0, registry.counter("settlement.webhook",
                "event_type", "payment_intent.succeeded", "outcome", "applied").count());
    }

    @Test
    @DisplayName("Redelivery of an applied event is a duplicate")
    void duplicateDeliveryIsAcknowledged() {
        when(eventProcessor.processEvent(eq("evt_1"), any(), any(), any(), any(), any())).thenReturn(false);

        WebhookReceipt receipt = reconciler.reconcile(event("evt_1", "payment_intent.succeeded"), SIGNATURE);

        assertEquals(WebhookOutcome.DUPLICATE, receipt.getOutcome());
        assertTrue(handled.isEmpty());
    }

    @Test
    void concurrentDeliveryIsDuplicate() {
        when(eventProcessor.processEvent(any(), any(), any(), any(), any(), any()))
                .thenThrow(new DataIntegrityViolationException("uq_processed_events_event_group"));
        when(eventProcessor.isAlreadyProcessed("evt_1", WebhookReconciler.CONSUMER_GROUP)).thenReturn(true);

        WebhookReceipt receipt = reconciler.reconcile(event("evt_1", "payment_intent.succeeded"), SIGNATURE);

        assertEquals(WebhookOutcome.DUPLICATE, receipt.getOutcome());
    }

    @Test
    @DisplayName("Constraint violation from the handler's own writes is FAILED, not a duplicate")
    void handlerConstraintViolationIsFailed() {
        when(eventProcessor.processEvent(any(), any(), any(), any(), any(), any()))
                .thenThrow(new DataIntegrityViolationException("chk_transactions_amounts"));
        when(eventProcessor.isAlreadyProcessed("evt_1", WebhookReconciler.CONSUMER_GROUP)).thenReturn(false);

        WebhookReceipt receipt = reconciler.reconcile(event("evt_1", "payment_intent.succeeded"), SIGNATURE);

        assertEquals(WebhookOutcome.FAILED, receipt.getOutcome());
    }

    @Test
    @DisplayName("Handler failure is acknowledged as FAILED")
    void handlerFailureIsAcknowledged() {
        runHandlerWhenProcessed();
        handlerFailure = new IllegalArgumentException("Unknown payment reference pi_1");

        WebhookReceipt receipt = reconciler.reconcile(event("evt_1", "payment_intent.succeeded"), SIGNATURE);

        assertEquals(WebhookOutcome.FAILED, receipt.getOutcome());
        assertEquals(1.0, registry.counter("settlement.webhook",
                "event_type", "payment_intent.succeeded", "outcome", "failed").count());
    }

    @Test
    void unknownEventTypeIsRecordedAsUnhandled() {
        when(eventProcessor.skipEvent(eq("evt_2"), eq("charge.refunded"), eq("ProviderEvent"), eq("pi_1"),
                eq(WebhookReconciler.CONSUMER_GROUP), anyString())).thenReturn(true);

        WebhookReceipt receipt = reconciler.reconcile(event("evt_2", "charge.refunded"), SIGNATURE);

        assertEquals(WebhookOutcome.UNHANDLED, receipt.getOutcome());
        verify(eventProcessor, never()).processEvent(any(), any(), any(), any(), any(), any());
    }

    @Test
    void repeatedUnknownEventIsDuplicate() {
        when(eventProcessor.skipEvent(any(), any(), any(), any(), any(), any())).thenReturn(false);

        assertEquals(WebhookOutcome.DUPLICATE,
                reconciler.reconcile(event("evt_2", "charge.refunded"), SIGNATURE).getOutcome());
    }

    @Test
    void unparseableEnvelopeIsAcknowledged() {
        assertEquals(WebhookOutcome.UNPARSEABLE, reconciler.reconcile("not json", SIGNATURE).getOutcome());
        assertEquals(WebhookOutcome.UNPARSEABLE,
                reconciler.reconcile("{\"type\":\"payment_intent.succeeded\"}", SIGNATURE).getOutcome());
        verifyNoInteractions(eventProcessor);
    }

    @Test
    void invalidSignatureIsRejectedBeforeParsing() {
        doThrow(new InvalidSignatureException("bad signature"))
                .when(signatureVerifier).verify(anyString(), eq("t=1,v1=forged"));

        assertThrows(InvalidSignatureException.class,
                () -> reconciler.reconcile(event("evt_1", "payment_intent.succeeded"), "t=1,v1=forged"));
        verifyNoInteractions(eventProcessor);
        assertTrue(handled.isEmpty());
    }

    private void runHandlerWhenProcessed() {
        when(eventProcessor.processEvent(any(), any(), any(), any(), any(), any())).thenAnswer(inv -> {
            Runnable handler = inv.getArgument(5);
            handler.run();
            return true;
        });
    }

    private static String event(String id, String type) {
        return "{\"id\":\"" + id + "\",\"type\":\"" + type + "\",\"created\":1700000000,"
                + "\"data\":{\"object\":{\"id\":\"pi_1\",\"object\":\"payment_intent\"}}}";
    }
}
