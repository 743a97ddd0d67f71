package com.flagship.settlement.transaction;

import java.util.Locale;

/**
 * ISO-4217 currencies accepted for settlement. Amounts are always held in
 * the currency's minor unit.
 */
public enum CurrencyCode {
    USD,
    EUR,
    GBP,
    CAD,
    AUD;

    /**
     * Lowercase form expected by the payment provider API.
     */
    public String toProviderCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CurrencyCode fromProviderCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
