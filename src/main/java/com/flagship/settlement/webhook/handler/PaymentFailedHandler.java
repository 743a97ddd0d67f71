package com.flagship.settlement.webhook.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.settlement.transaction.TransactionLedger;
import com.flagship.settlement.webhook.ProviderEvent;
import com.flagship.settlement.webhook.WebhookEventHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;

@Component
@RequiredArgsConstructor
public class PaymentFailedHandler implements WebhookEventHandler {

    private final PaymentReferenceResolver referenceResolver;
    private final TransactionLedger ledger;

    @Override
    public Set<String> supportedEventTypes() {
        return Set.of("payment_intent.payment_failed", "payment_intent.canceled");
    }

    @Override
    public void handle(ProviderEvent event) {
        ledger.markFailed(referenceResolver.resolve(event), failureReason(event));
    }

    private String failureReason(ProviderEvent event) {
        JsonNode lastError = event.getObject().path("last_payment_error");
        if (lastError.hasNonNull("message")) {
            return lastError.get("message").asText();
        }
        if (lastError.hasNonNull("code")) {
            return lastError.get("code").asText();
        }
        String cancellation = event.field("cancellation_reason");
        return cancellation != null ? "canceled: " + cancellation : event.getType();
    }
}
