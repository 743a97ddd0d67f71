package com.flagship.settlement.payout;

import com.flagship.settlement.transaction.CurrencyCode;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class Payout {
    UUID id;
    UUID sellerId;
    long amount;
    CurrencyCode currency;
    PayoutStatus status;
    String destinationAccountId;
    String externalPayoutId;
    String failureReason;
    Instant createdAt;

    /**
     * A payout the provider has accepted.
     */
    public static Payout accepted(UUID id, UUID sellerId, long amount, CurrencyCode currency,
                                  String destinationAccountId, String externalPayoutId) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Payout amount must be positive: " + amount);
        }
        return new Payout(id, sellerId, amount, currency, PayoutStatus.PENDING,
            destinationAccountId, externalPayoutId, null, Instant.now());
    }

    /**
     * A payout the provider refused or did not answer.
     */
    public static Payout rejected(UUID id, UUID sellerId, long amount, CurrencyCode currency,
                                  String destinationAccountId, String reason) {
        return new Payout(id, sellerId, amount, currency, PayoutStatus.FAILED,
            destinationAccountId, null, reason, Instant.now());
    }
}
