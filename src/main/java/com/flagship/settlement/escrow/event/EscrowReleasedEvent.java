package com.flagship.settlement.escrow.event;

import com.flagship.settlement.escrow.Escrow;
import com.flagship.settlement.outbox.SettlementEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class EscrowReleasedEvent implements SettlementEvent {
    public static final String EVENT_TYPE = "EscrowReleased";

    UUID eventId;
    UUID escrowId;
    UUID transactionId;
    UUID sellerId;
    long heldAmount;
    UUID releasedBy;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static EscrowReleasedEvent from(Escrow escrow) {
        return new EscrowReleasedEvent(
            UUID.randomUUID(),
            escrow.getId(),
            escrow.getTransactionId(),
            escrow.getSellerId(),
            escrow.getHeldAmount(),
            escrow.getReleasedBy(),
            Instant.now()
        );
    }
}
