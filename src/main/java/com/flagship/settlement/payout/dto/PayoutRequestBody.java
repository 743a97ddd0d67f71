package com.flagship.settlement.payout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class PayoutRequestBody {

    @NotNull(message = "seller_id is required")
    @JsonProperty("seller_id")
    UUID sellerId;

    /** Minor units. Omit to pay out the full available balance. */
    @JsonProperty("amount")
    Long amount;
}
