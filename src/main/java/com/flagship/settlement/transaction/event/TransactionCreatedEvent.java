package com.flagship.settlement.transaction.event;

import com.flagship.settlement.outbox.SettlementEvent;
import com.flagship.settlement.transaction.Transaction;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class TransactionCreatedEvent implements SettlementEvent {
    public static final String EVENT_TYPE = "TransactionCreated";

    UUID eventId;
    UUID transactionId;
    UUID buyerId;
    UUID sellerId;
    UUID itemId;
    long grossAmount;
    long platformFee;
    long processorFee;
    long sellerNet;
    String currency;
    boolean usesEscrow;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransactionCreatedEvent from(Transaction tx) {
        return new TransactionCreatedEvent(
            UUID.randomUUID(),
            tx.getId(),
            tx.getBuyerId(),
            tx.getSellerId(),
            tx.getItemId(),
            tx.getGrossAmount(),
            tx.getPlatformFee(),
            tx.getProcessorFee(),
            tx.getSellerNet(),
            tx.getCurrency().name(),
            tx.isUsesEscrow(),
            Instant.now()
        );
    }
}
