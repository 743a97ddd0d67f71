package com.flagship.settlement.transaction;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "settlement_refunds")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionRefundEntity {

    @Id
    @Column(name = "transaction_id", nullable = false, updatable = false)
    private UUID transactionId;

    @Column(name = "charge_reference")
    private String chargeReference;

    @Column(name = "refunded_amount", nullable = false)
    private long refundedAmount;

    @Column(name = "seller_refund_amount", nullable = false)
    private long sellerRefundAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private CurrencyCode currency;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static TransactionRefundEntity fromDomain(TransactionRefund refund) {
        return new TransactionRefundEntity(
            refund.getTransactionId(),
            refund.getChargeReference(),
            refund.getRefundedAmount(),
            refund.getSellerRefundAmount(),
            refund.getCurrency(),
            null,
            null
        );
    }

    public TransactionRefund toDomain() {
        return new TransactionRefund(
            transactionId,
            chargeReference,
            refundedAmount,
            sellerRefundAmount,
            currency,
            updatedAt
        );
    }
}
