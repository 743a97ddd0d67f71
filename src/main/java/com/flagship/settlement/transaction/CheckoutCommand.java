package com.flagship.settlement.transaction;

import lombok.Value;

import java.util.UUID;

@Value
public class CheckoutCommand {
    UUID itemId;
    UUID buyerId;
    String paymentMethodRef;
    boolean usesEscrow;
    UUID affiliateClickId;
    String idempotencyKey;
}
