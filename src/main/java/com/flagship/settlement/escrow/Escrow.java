package com.flagship.settlement.escrow;

import com.flagship.settlement.transaction.CurrencyCode;
import com.flagship.settlement.transaction.Transaction;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Seller proceeds held back until someone releases them.
 *
 * The held amount is the parent transaction's seller net and never changes.
 * Transitions: HELD to RELEASED, or HELD to DISPUTED to RELEASED once the
 * dispute is resolved by an administrator. After release the funds are
 * transferred to the seller and the transfer reference is recorded.
 */
@Value
public class Escrow {
    UUID id;
    UUID transactionId;
    UUID buyerId;
    UUID sellerId;
    long heldAmount;
    CurrencyCode currency;
    EscrowStatus status;
    UUID releasedBy;
    Instant releasedAt;
    UUID disputedBy;
    Instant disputedAt;
    /** Provider transfer that moved the released funds to the seller. */
    String transferReference;
    Instant createdAt;

    public static Escrow holdFor(Transaction transaction) {
        if (!transaction.isUsesEscrow()) {
            throw new IllegalArgumentException("Transaction " + transaction.getId() + " does not use escrow");
        }
        return new Escrow(
            UUID.randomUUID(),
            transaction.getId(),
            transaction.getBuyerId(),
            transaction.getSellerId(),
            transaction.getSellerNet(),
            transaction.getCurrency(),
            EscrowStatus.HELD,
            null,
            null,
            null,
            null,
            null,
            Instant.now()
        );
    }

    public boolean isParty(UUID actorId) {
        return buyerId.equals(actorId) || sellerId.equals(actorId);
    }

    public boolean isReleased() {
        return status == EscrowStatus.RELEASED;
    }
}
