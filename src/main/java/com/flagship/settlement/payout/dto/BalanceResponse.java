package com.flagship.settlement.payout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

@Value
public class BalanceResponse {

    @JsonProperty("seller_id")
    UUID sellerId;

    @JsonProperty("available_balance_minor_units")
    long availableBalanceMinorUnits;
}
