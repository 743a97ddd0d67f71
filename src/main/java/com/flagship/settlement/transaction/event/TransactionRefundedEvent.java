package com.flagship.settlement.transaction.event;

import com.flagship.settlement.outbox.SettlementEvent;
import com.flagship.settlement.transaction.Transaction;
import com.flagship.settlement.transaction.TransactionRefund;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class TransactionRefundedEvent implements SettlementEvent {
    public static final String EVENT_TYPE = "TransactionRefunded";

    UUID eventId;
    UUID transactionId;
    UUID sellerId;
    String paymentReference;
    long refundedAmount;
    long sellerRefundAmount;
    String currency;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransactionRefundedEvent from(Transaction tx, TransactionRefund refund) {
        return new TransactionRefundedEvent(
            UUID.randomUUID(),
            tx.getId(),
            tx.getSellerId(),
            tx.getPaymentReference(),
            refund.getRefundedAmount(),
            refund.getSellerRefundAmount(),
            refund.getCurrency().name(),
            Instant.now()
        );
    }
}
