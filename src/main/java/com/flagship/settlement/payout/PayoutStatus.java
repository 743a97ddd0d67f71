package com.flagship.settlement.payout;

/**
 * PENDING once the provider accepted the payout request, then COMPLETED or
 * FAILED when the provider reports the outcome. A payout the provider refused
 * outright is stored as FAILED straight away. FAILED payouts do not reduce the
 * seller's available balance.
 */
public enum PayoutStatus {
    PENDING,
    COMPLETED,
    FAILED;

    public boolean reservesBalance() {
        return this != FAILED;
    }
}
