package com.flagship.settlement.affiliate.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class CommissionRequest {

    @NotNull(message = "click_id is required")
    @JsonProperty("click_id")
    UUID clickId;

    @NotNull(message = "transaction_id is required")
    @JsonProperty("transaction_id")
    UUID transactionId;
}
