package com.flagship.settlement.webhook;

import com.flagship.settlement.observability.SettlementMetrics;
import com.flagship.settlement.webhook.dto.WebhookResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Payment provider webhook endpoint.
 *
 * The body is taken as a raw string because the signature covers the exact
 * bytes sent. Answers 200 for every verified delivery and 400 only when the
 * signature check fails.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    private static final String SIGNATURE_HEADER = "Stripe-Signature";

    private final WebhookReconciler reconciler;
    private final SettlementMetrics metrics;

    @PostMapping("/api/webhooks/payments")
    public WebhookResponse receive(
            @RequestBody(required = false) String payload,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {

        long startTime = System.currentTimeMillis();
        try {
            WebhookReceipt receipt = reconciler.reconcile(payload, signature);
            log.debug("Webhook {} ({}) -> {}", receipt.getEventId(), receipt.getEventType(), receipt.getOutcome());
            return WebhookResponse.from(receipt);
        } finally {
            metrics.recordLatency("webhook", System.currentTimeMillis() - startTime);
        }
    }
}
