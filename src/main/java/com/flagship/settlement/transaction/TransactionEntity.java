package com.flagship.settlement.transaction;

import com.flagship.settlement.fee.EarnerCategory;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of settlement_transactions.
 *
 * No setters: amounts are fixed at creation, and status, payment reference
 * and failure reason only change through the conditional updates in
 * {@link TransactionRepository}.
 */
@Entity
@Table(
    name = "settlement_transactions",
    indexes = {
        @Index(name = "idx_transactions_seller_status", columnList = "seller_id, status"),
        @Index(name = "idx_transactions_status_created", columnList = "status, created_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "buyer_id", nullable = false, updatable = false)
    private UUID buyerId;

    @Column(name = "seller_id", nullable = false, updatable = false)
    private UUID sellerId;

    @Column(name = "item_id", nullable = false, updatable = false)
    private UUID itemId;

    @Column(name = "gross_amount", nullable = false, updatable = false)
    private long grossAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private CurrencyCode currency;

    @Column(name = "platform_fee", nullable = false, updatable = false)
    private long platformFee;

    @Column(name = "processor_fee", nullable = false, updatable = false)
    private long processorFee;

    @Column(name = "seller_net", nullable = false, updatable = false)
    private long sellerNet;

    @Enumerated(EnumType.STRING)
    @Column(name = "earner_category", nullable = false, updatable = false, length = 30)
    private EarnerCategory earnerCategory;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TransactionStatus status;

    @Column(name = "uses_escrow", nullable = false, updatable = false)
    private boolean usesEscrow;

    @Column(name = "payment_reference", unique = true)
    private String paymentReference;

    @Column(name = "idempotency_key", nullable = false, unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "affiliate_click_id", updatable = false)
    private UUID affiliateClickId;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

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

    static TransactionEntity fromDomain(Transaction transaction, String idempotencyKey) {
        return new TransactionEntity(
            transaction.getId(),
            transaction.getBuyerId(),
            transaction.getSellerId(),
            transaction.getItemId(),
            transaction.getGrossAmount(),
            transaction.getCurrency(),
            transaction.getPlatformFee(),
            transaction.getProcessorFee(),
            transaction.getSellerNet(),
            transaction.getEarnerCategory(),
            transaction.getStatus(),
            transaction.isUsesEscrow(),
            transaction.getPaymentReference(),
            idempotencyKey,
            transaction.getAffiliateClickId(),
            transaction.getFailureReason(),
            null,
            null
        );
    }

    public Transaction toDomain() {
        return new Transaction(
            id,
            buyerId,
            sellerId,
            itemId,
            grossAmount,
            currency,
            platformFee,
            processorFee,
            sellerNet,
            earnerCategory,
            status,
            usesEscrow,
            paymentReference,
            affiliateClickId,
            failureReason,
            createdAt,
            updatedAt
        );
    }
}
