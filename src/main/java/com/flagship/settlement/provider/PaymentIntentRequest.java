package com.flagship.settlement.provider;

import com.flagship.settlement.transaction.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * Charge request for one checkout. Without escrow exactly {@code sellerNet}
 * is transferred to the seller's connected account and the platform keeps
 * the rest (its fee and the processor fee); with escrow the platform holds
 * the full amount until release.
 */
@Value
@Builder
public class PaymentIntentRequest {
    UUID transactionId;
    long amount;
    CurrencyCode currency;
    String paymentMethodRef;
    String destinationAccountId;
    long sellerNet;
    boolean usesEscrow;
    Map<String, String> metadata;
    String idempotencyKey;
}
