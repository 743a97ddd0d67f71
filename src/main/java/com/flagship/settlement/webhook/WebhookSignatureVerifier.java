package com.flagship.settlement.webhook;

import com.flagship.settlement.config.SettlementProperties;
import com.flagship.settlement.exception.InvalidSignatureException;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.net.Webhook;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Verifies the provider's {@code Stripe-Signature} header against the raw
 * request body. A missing secret, a missing header, a bad signature and a
 * timestamp outside the tolerance all fail the same way.
 */
@Component
@RequiredArgsConstructor
public class WebhookSignatureVerifier {

    private final SettlementProperties properties;

    public void verify(String payload, String signatureHeader) {
        String secret = properties.getProvider().getWebhookSecret();
        if (secret == null || secret.isBlank()) {
            throw new InvalidSignatureException("Webhook secret is not configured");
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new InvalidSignatureException("Signature header is missing");
        }
        if (payload == null) {
            throw new InvalidSignatureException("Request body is missing");
        }

        try {
            Webhook.Signature.verifyHeader(payload, signatureHeader, secret,
                properties.getProvider().getWebhookToleranceSeconds());
        } catch (SignatureVerificationException e) {
            throw new InvalidSignatureException(e.getMessage(), e);
        }
    }
}
