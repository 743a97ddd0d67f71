package com.flagship.settlement.affiliate;

/**
 * Payout progress of an affiliate commission. The core only ever writes
 * PENDING; approval and payment belong to the affiliate payout collaborator.
 */
public enum ConversionPayoutStatus {
    PENDING,
    APPROVED,
    PAID
}
