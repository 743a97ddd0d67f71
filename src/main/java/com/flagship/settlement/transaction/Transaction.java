package com.flagship.settlement.transaction;

import com.flagship.settlement.fee.EarnerCategory;
import com.flagship.settlement.fee.FeeBreakdown;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One purchase attempt and its fee split.
 *
 * Lifecycle: PENDING at checkout, then SUCCEEDED or FAILED once the provider
 * reports the outcome. Both outcomes are terminal. Transition methods return a
 * new instance and reject moves out of a terminal state.
 */
@Value
public class Transaction {
    UUID id;
    UUID buyerId;
    UUID sellerId;
    UUID itemId;
    long grossAmount;
    CurrencyCode currency;
    long platformFee;
    long processorFee;
    long sellerNet;
    EarnerCategory earnerCategory;
    TransactionStatus status;
    boolean usesEscrow;
    String paymentReference;
    UUID affiliateClickId;
    String failureReason;
    Instant createdAt;
    Instant updatedAt;

    public static Transaction pending(UUID id, UUID buyerId, UUID sellerId, UUID itemId,
                                      FeeBreakdown fees, CurrencyCode currency,
                                      EarnerCategory earnerCategory, boolean usesEscrow,
                                      UUID affiliateClickId) {
        if (fees.getPlatformFee() + fees.getProcessorFee() + fees.getSellerNet() != fees.getGrossAmount()
                || fees.getSellerNet() < 0) {
            throw new IllegalArgumentException("Fee breakdown does not add up to the gross amount: " + fees);
        }
        Instant now = Instant.now();
        return new Transaction(
            id,
            buyerId,
            sellerId,
            itemId,
            fees.getGrossAmount(),
            currency,
            fees.getPlatformFee(),
            fees.getProcessorFee(),
            fees.getSellerNet(),
            earnerCategory,
            TransactionStatus.PENDING,
            usesEscrow,
            null,
            affiliateClickId,
            null,
            now,
            now
        );
    }

    public Transaction succeed() {
        requirePending(TransactionStatus.SUCCEEDED);
        return withStatus(TransactionStatus.SUCCEEDED, null);
    }

    public Transaction fail(String reason) {
        requirePending(TransactionStatus.FAILED);
        return withStatus(TransactionStatus.FAILED, reason);
    }

    public boolean isSucceeded() {
        return status == TransactionStatus.SUCCEEDED;
    }

    /**
     * Same-status moves count as allowed: they are idempotent no-ops.
     */
    public boolean canTransitionTo(TransactionStatus target) {
        return status == target || status == TransactionStatus.PENDING;
    }

    private void requirePending(TransactionStatus target) {
        if (status != TransactionStatus.PENDING) {
            throw new IllegalStateException(String.format(
                "Cannot move transaction %s from %s to %s. Only PENDING transactions can transition.",
                id, status, target));
        }
    }

    private Transaction withStatus(TransactionStatus newStatus, String reason) {
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
            newStatus,
            usesEscrow,
            paymentReference,
            affiliateClickId,
            reason,
            createdAt,
            Instant.now()
        );
    }
}
