package com.flagship.settlement.provider;

import com.flagship.settlement.exception.ExternalServiceException;

/**
 * Outbound calls to the payment provider.
 *
 * Every method either returns the provider's answer or throws
 * {@link ExternalServiceException}; timeouts are flagged on the exception so
 * callers can tell an unanswered request from a refused one.
 */
public interface PaymentProviderGateway {

    PaymentIntentResult createPaymentIntent(PaymentIntentRequest request);

    /**
     * Returns the client secret of an existing payment intent, used when a
     * checkout is replayed with the same idempotency key.
     */
    String retrieveClientSecret(String paymentReference);

    PayoutResult createPayout(PayoutRequest request);

    /**
     * Transfers released escrow funds to the seller. Repeating the call for
     * the same escrow returns the original transfer.
     */
    TransferResult createTransfer(TransferRequest request);
}
