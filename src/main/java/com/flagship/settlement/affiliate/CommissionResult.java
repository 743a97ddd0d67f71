package com.flagship.settlement.affiliate;

import com.flagship.settlement.transaction.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class CommissionResult {
    UUID conversionId;
    long commissionAmount;
    BigDecimal commissionRate;
    CurrencyCode currency;
    ConversionPayoutStatus payoutStatus;

    public static CommissionResult from(Conversion conversion) {
        return new CommissionResult(
            conversion.getId(),
            conversion.getCommissionAmount(),
            conversion.getCommissionRate(),
            conversion.getCurrency(),
            conversion.getPayoutStatus()
        );
    }
}
