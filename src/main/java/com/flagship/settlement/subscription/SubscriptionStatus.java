package com.flagship.settlement.subscription;

import java.util.Locale;

public enum SubscriptionStatus {
    ACTIVE,
    TRIALING,
    PAST_DUE,
    CANCELED,
    INCOMPLETE,
    UNPAID;

    /**
     * Maps the provider's lowercase status. An expired incomplete
     * subscription never started, so it is treated as canceled.
     *
     * @throws IllegalArgumentException for statuses this service does not track
     */
    public static SubscriptionStatus fromProviderCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Subscription status is missing");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        if ("INCOMPLETE_EXPIRED".equals(normalized)) {
            return CANCELED;
        }
        return valueOf(normalized);
    }
}
