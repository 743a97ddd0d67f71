package com.flagship.settlement.affiliate;

import com.flagship.settlement.exception.SettlementErrorCode;
import com.flagship.settlement.exception.ValidationException;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

@Value
public class AffiliateCampaign {
    UUID id;
    UUID affiliateId;
    UUID itemId;
    String commissionType;
    /** Percent with two decimals, e.g. 10.00. Only set for percentage campaigns. */
    BigDecimal commissionRate;
    Long fixedCommissionAmount;
    boolean active;
    Integer maxConversions;
    int totalConversions;

    public boolean hasReachedConversionLimit() {
        return maxConversions != null && totalConversions >= maxConversions;
    }

    /**
     * Commission owed on a sale of {@code grossAmount} minor units. The result
     * is not bounds-checked here.
     */
    public long commissionFor(long grossAmount) {
        CommissionType type = CommissionType.fromCode(commissionType);
        if (type == CommissionType.FIXED) {
            return fixedCommissionAmount != null ? fixedCommissionAmount : 0L;
        }
        if (commissionRate == null) {
            throw new ValidationException(SettlementErrorCode.INVALID_COMMISSION,
                "Percentage campaign " + id + " has no commission rate");
        }
        return BigDecimal.valueOf(grossAmount)
            .multiply(commissionRate)
            .divide(BigDecimal.valueOf(100), 0, RoundingMode.HALF_UP)
            .longValueExact();
    }
}
