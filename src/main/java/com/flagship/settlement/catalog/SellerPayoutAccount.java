package com.flagship.settlement.catalog;

import lombok.Value;

import java.util.UUID;

/**
 * A seller's connected account at the payment provider.
 */
@Value
public class SellerPayoutAccount {
    UUID sellerId;
    String providerAccountId;
    boolean chargesEnabled;
    boolean payoutsEnabled;
}
