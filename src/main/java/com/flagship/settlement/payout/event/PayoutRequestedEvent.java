package com.flagship.settlement.payout.event;

import com.flagship.settlement.outbox.SettlementEvent;
import com.flagship.settlement.payout.Payout;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class PayoutRequestedEvent implements SettlementEvent {
    public static final String EVENT_TYPE = "PayoutRequested";

    UUID eventId;
    UUID payoutId;
    UUID sellerId;
    long amount;
    String currency;
    String externalPayoutId;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PayoutRequestedEvent from(Payout payout) {
        return new PayoutRequestedEvent(
            UUID.randomUUID(),
            payout.getId(),
            payout.getSellerId(),
            payout.getAmount(),
            payout.getCurrency().name(),
            payout.getExternalPayoutId(),
            Instant.now()
        );
    }
}
