package com.flagship.settlement.fee;

import java.util.Locale;

/**
 * Seller classification that determines the platform fee rate.
 * Rates are in basis points of the gross amount.
 */
public enum EarnerCategory {
    CREATOR(1500),
    VENDOR(1200),
    DEVELOPER(2000),
    ADVERTISER(1500),
    AFFILIATE(1000),
    INFLUENCER(1800);

    private final int platformRateBps;

    EarnerCategory(int platformRateBps) {
        this.platformRateBps = platformRateBps;
    }

    public int getPlatformRateBps() {
        return platformRateBps;
    }

    /**
     * Resolves a stored category code. Missing or unrecognised codes use the vendor rate.
     */
    public static EarnerCategory fromCode(String code) {
        if (code == null || code.isBlank()) {
            return VENDOR;
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return VENDOR;
        }
    }
}
