package com.flagship.settlement.subscription;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ProviderSubscription {
    UUID id;
    String providerSubscriptionId;
    String customerReference;
    UUID userId;
    String tier;
    SubscriptionStatus status;
    Instant currentPeriodEnd;
    Instant lastEventAt;
}
