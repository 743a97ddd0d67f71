package com.flagship.settlement.escrow;

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
@Table(name = "escrows")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EscrowEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "transaction_id", nullable = false, unique = true, updatable = false)
    private UUID transactionId;

    @Column(name = "buyer_id", nullable = false, updatable = false)
    private UUID buyerId;

    @Column(name = "seller_id", nullable = false, updatable = false)
    private UUID sellerId;

    @Column(name = "held_amount", nullable = false, updatable = false)
    private long heldAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private CurrencyCode currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EscrowStatus status;

    @Column(name = "released_by")
    private UUID releasedBy;

    @Column(name = "released_at")
    private Instant releasedAt;

    @Column(name = "disputed_by")
    private UUID disputedBy;

    @Column(name = "disputed_at")
    private Instant disputedAt;

    @Column(name = "transfer_reference")
    private String transferReference;

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

    static EscrowEntity fromDomain(Escrow escrow) {
        return new EscrowEntity(
            escrow.getId(),
            escrow.getTransactionId(),
            escrow.getBuyerId(),
            escrow.getSellerId(),
            escrow.getHeldAmount(),
            escrow.getCurrency(),
            escrow.getStatus(),
            escrow.getReleasedBy(),
            escrow.getReleasedAt(),
            escrow.getDisputedBy(),
            escrow.getDisputedAt(),
            escrow.getTransferReference(),
            null,
            null
        );
    }

    public Escrow toDomain() {
        return new Escrow(
            id,
            transactionId,
            buyerId,
            sellerId,
            heldAmount,
            currency,
            status,
            releasedBy,
            releasedAt,
            disputedBy,
            disputedAt,
            transferReference,
            createdAt
        );
    }
}
