package com.flagship.settlement.affiliate;

import com.flagship.settlement.exception.SettlementErrorCode;
import com.flagship.settlement.exception.ValidationException;

import java.util.Locale;

/**
 * How a campaign pays its affiliate.
 *
 * PERCENTAGE pays {@code commission_rate} percent of the transaction gross.
 * FIXED pays {@code fixed_commission_amount} regardless of the price.
 */
public enum CommissionType {
    PERCENTAGE,
    FIXED;

    /**
     * Parses the stored campaign type.
     *
     * @throws ValidationException UNSUPPORTED_COMMISSION_TYPE for any other value
     */
    public static CommissionType fromCode(String code) {
        if (code != null) {
            for (CommissionType type : values()) {
                if (type.name().equals(code.trim().toUpperCase(Locale.ROOT))) {
                    return type;
                }
            }
        }
        throw new ValidationException(SettlementErrorCode.UNSUPPORTED_COMMISSION_TYPE,
            "Unsupported commission type: " + code);
    }
}
