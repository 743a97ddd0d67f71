package com.flagship.settlement.escrow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class EscrowActionRequest {

    @NotNull(message = "actor_id is required")
    @JsonProperty("actor_id")
    UUID actorId;
}
