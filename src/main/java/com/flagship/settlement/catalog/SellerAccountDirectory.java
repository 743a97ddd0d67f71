package com.flagship.settlement.catalog;

import java.util.Optional;
import java.util.UUID;

/**
 * Lookup of seller payout destinations.
 */
public interface SellerAccountDirectory {

    Optional<SellerPayoutAccount> findBySellerId(UUID sellerId);

    /**
     * Locks the seller's account row until the current transaction ends.
     * Used to serialize payout requests for one seller.
     */
    Optional<SellerPayoutAccount> lockBySellerId(UUID sellerId);

    /**
     * Applies capability flags reported by the provider.
     *
     * @return false if no seller is linked to the provider account
     */
    boolean updateCapabilities(String providerAccountId, boolean chargesEnabled, boolean payoutsEnabled);
}
