package com.flagship.settlement.transaction.event;

import com.flagship.settlement.outbox.SettlementEvent;
import com.flagship.settlement.transaction.Transaction;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when the provider confirms payment. Carries the referral click,
 * if any, so the commission consumer can record the conversion.
 */
@Value
public class TransactionSucceededEvent implements SettlementEvent {
    public static final String EVENT_TYPE = "TransactionSucceeded";

    UUID eventId;
    UUID transactionId;
    UUID sellerId;
    String paymentReference;
    long grossAmount;
    long sellerNet;
    String currency;
    UUID affiliateClickId;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransactionSucceededEvent from(Transaction tx) {
        return new TransactionSucceededEvent(
            UUID.randomUUID(),
            tx.getId(),
            tx.getSellerId(),
            tx.getPaymentReference(),
            tx.getGrossAmount(),
            tx.getSellerNet(),
            tx.getCurrency().name(),
            tx.getAffiliateClickId(),
            Instant.now()
        );
    }
}
