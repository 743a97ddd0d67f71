package com.flagship.settlement.transaction;

import lombok.Value;

/**
 * Outcome of a checkout. {@code replayed} is true when the idempotency key
 * had already been used and the original transaction is returned.
 */
@Value
public class CheckoutResult {
    Transaction transaction;
    String providerClientSecret;
    boolean replayed;
}
