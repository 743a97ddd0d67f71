package com.flagship.settlement.escrow.event;

import com.flagship.settlement.escrow.Escrow;
import com.flagship.settlement.outbox.SettlementEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class EscrowDisputedEvent implements SettlementEvent {
    public static final String EVENT_TYPE = "EscrowDisputed";

    UUID eventId;
    UUID escrowId;
    UUID transactionId;
    UUID disputedBy;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static EscrowDisputedEvent from(Escrow escrow) {
        return new EscrowDisputedEvent(
            UUID.randomUUID(),
            escrow.getId(),
            escrow.getTransactionId(),
            escrow.getDisputedBy(),
            Instant.now()
        );
    }
}
