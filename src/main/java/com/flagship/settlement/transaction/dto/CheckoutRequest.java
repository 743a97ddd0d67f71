package com.flagship.settlement.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class CheckoutRequest {

    @NotNull(message = "Item ID is required")
    @JsonProperty("item_id")
    UUID itemId;

    @NotNull(message = "Buyer ID is required")
    @JsonProperty("buyer_id")
    UUID buyerId;

    @JsonProperty("payment_method_ref")
    String paymentMethodRef;

    @JsonProperty("uses_escrow")
    boolean usesEscrow;

    /** Affiliate click that referred this purchase, if any. */
    @JsonProperty("click_id")
    UUID clickId;
}
