package com.flagship.settlement.webhook.handler;

import com.flagship.settlement.transaction.TransactionLedger;
import com.flagship.settlement.webhook.ProviderEvent;
import com.flagship.settlement.webhook.WebhookEventHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;

@Component
@RequiredArgsConstructor
public class PaymentSucceededHandler implements WebhookEventHandler {

    private final PaymentReferenceResolver referenceResolver;
    private final TransactionLedger ledger;

    @Override
    public Set<String> supportedEventTypes() {
        return Set.of("payment_intent.succeeded", PaymentReferenceResolver.CHECKOUT_SESSION_COMPLETED);
    }

    @Override
    public void handle(ProviderEvent event) {
        ledger.markSucceeded(referenceResolver.resolve(event));
    }
}
