package com.flagship.settlement.payout;

import com.flagship.settlement.transaction.CurrencyCode;
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
@Table(name = "payouts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PayoutEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "seller_id", nullable = false, updatable = false)
    private UUID sellerId;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private CurrencyCode currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PayoutStatus status;

    @Column(name = "destination_account_id", nullable = false, updatable = false)
    private String destinationAccountId;

    @Column(name = "external_payout_id", unique = true, updatable = false)
    private String externalPayoutId;

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

    static PayoutEntity fromDomain(Payout payout) {
        return new PayoutEntity(
            payout.getId(),
            payout.getSellerId(),
            payout.getAmount(),
            payout.getCurrency(),
            payout.getStatus(),
            payout.getDestinationAccountId(),
            payout.getExternalPayoutId(),
            payout.getFailureReason(),
            null,
            null
        );
    }

    public Payout toDomain() {
        return new Payout(
            id,
            sellerId,
            amount,
            currency,
            status,
            destinationAccountId,
            externalPayoutId,
            failureReason,
            createdAt
        );
    }
}
