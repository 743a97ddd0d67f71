package com.flagship.settlement.subscription;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Subscription state as reported by one provider event.
 */
@Value
public class SubscriptionUpdate {
    String providerSubscriptionId;
    String customerReference;
    UUID userId;
    String tier;
    SubscriptionStatus status;
    Instant currentPeriodEnd;
    /** Provider creation time of the event carrying this state. */
    Instant eventAt;
}
