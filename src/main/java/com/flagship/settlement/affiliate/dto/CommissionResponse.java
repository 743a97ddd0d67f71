package com.flagship.settlement.affiliate.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement.affiliate.CommissionResult;
import com.flagship.settlement.affiliate.ConversionPayoutStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class CommissionResponse {

    @JsonProperty("conversion_id")
    UUID conversionId;

    @JsonProperty("commission_amount")
    long commissionAmount;

    @JsonProperty("commission_rate")
    BigDecimal commissionRate;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("payout_status")
    ConversionPayoutStatus payoutStatus;

    public static CommissionResponse from(CommissionResult result) {
        return new CommissionResponse(
            result.getConversionId(),
            result.getCommissionAmount(),
            result.getCommissionRate(),
            result.getCurrency().name(),
            result.getPayoutStatus()
        );
    }
}
