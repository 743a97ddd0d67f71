package com.flagship.settlement.transaction.event;

import com.flagship.settlement.outbox.SettlementEvent;
import com.flagship.settlement.transaction.Transaction;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class TransactionFailedEvent implements SettlementEvent {
    public static final String EVENT_TYPE = "TransactionFailed";

    UUID eventId;
    UUID transactionId;
    String paymentReference;
    String failureReason;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransactionFailedEvent from(Transaction tx) {
        return new TransactionFailedEvent(
            UUID.randomUUID(),
            tx.getId(),
            tx.getPaymentReference(),
            tx.getFailureReason(),
            Instant.now()
        );
    }
}
