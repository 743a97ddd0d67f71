package com.flagship.settlement.escrow.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement.escrow.Escrow;
import com.flagship.settlement.escrow.EscrowStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EscrowResponse {

    @JsonProperty("escrow_id")
    UUID escrowId;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("held_amount")
    long heldAmount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("status")
    EscrowStatus status;

    @JsonProperty("released_by")
    UUID releasedBy;

    @JsonProperty("released_at")
    Instant releasedAt;

    @JsonProperty("disputed_by")
    UUID disputedBy;

    @JsonProperty("disputed_at")
    Instant disputedAt;

    public static EscrowResponse from(Escrow escrow) {
        return EscrowResponse.builder()
            .escrowId(escrow.getId())
            .transactionId(escrow.getTransactionId())
            .heldAmount(escrow.getHeldAmount())
            .currency(escrow.getCurrency().name())
            .status(escrow.getStatus())
            .releasedBy(escrow.getReleasedBy())
            .releasedAt(escrow.getReleasedAt())
            .disputedBy(escrow.getDisputedBy())
            .disputedAt(escrow.getDisputedAt())
            .build();
    }
}
