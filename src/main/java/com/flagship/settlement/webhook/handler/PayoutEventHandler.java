package com.flagship.settlement.webhook.handler;

import com.flagship.settlement.payout.PayoutCalculator;
import com.flagship.settlement.webhook.ProviderEvent;
import com.flagship.settlement.webhook.WebhookEventHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Settles payouts the provider reports as paid or failed. Payouts this
 * service did not create are ignored.
 */
@Component
@RequiredArgsConstructor
public class PayoutEventHandler implements WebhookEventHandler {

    static final String PAYOUT_PAID = "payout.paid";

    private final PayoutCalculator payoutCalculator;

    @Override
    public Set<String> supportedEventTypes() {
        return Set.of(PAYOUT_PAID, "payout.failed");
    }

    @Override
    public void handle(ProviderEvent event) {
        String externalPayoutId = event.getObjectId();
        if (externalPayoutId == null) {
            throw new IllegalArgumentException("Payout event " + event.getId() + " has no payout id");
        }

        if (PAYOUT_PAID.equals(event.getType())) {
            payoutCalculator.markCompleted(externalPayoutId);
        } else {
            String reason = event.field("failure_message") != null
                ? event.field("failure_message")
                : event.field("failure_code");
            payoutCalculator.markFailed(externalPayoutId, reason);
        }
    }
}
