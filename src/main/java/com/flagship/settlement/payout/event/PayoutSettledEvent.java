package com.flagship.settlement.payout.event;

import com.flagship.settlement.outbox.SettlementEvent;
import com.flagship.settlement.payout.Payout;
import com.flagship.settlement.payout.PayoutStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when the provider reports a payout as paid or failed.
 */
@Value
public class PayoutSettledEvent implements SettlementEvent {
    public static final String EVENT_TYPE = "PayoutSettled";

    UUID eventId;
    UUID payoutId;
    UUID sellerId;
    long amount;
    PayoutStatus status;
    String failureReason;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PayoutSettledEvent from(Payout payout) {
        return new PayoutSettledEvent(
            UUID.randomUUID(),
            payout.getId(),
            payout.getSellerId(),
            payout.getAmount(),
            payout.getStatus(),
            payout.getFailureReason(),
            Instant.now()
        );
    }
}
