package com.flagship.settlement.payout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement.payout.Payout;
import com.flagship.settlement.payout.PayoutStatus;
import lombok.Value;

import java.util.UUID;

@Value
public class PayoutResponse {

    @JsonProperty("payout_id")
    UUID payoutId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("status")
    PayoutStatus status;

    @JsonProperty("external_payout_id")
    String externalPayoutId;

    public static PayoutResponse from(Payout payout) {
        return new PayoutResponse(
            payout.getId(),
            payout.getAmount(),
            payout.getCurrency().name(),
            payout.getStatus(),
            payout.getExternalPayoutId()
        );
    }
}
