package com.flagship.settlement.transaction;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface TransactionRefundRepository extends JpaRepository<TransactionRefundEntity, UUID> {

    /**
     * Raises the cumulative refund. Lower or equal amounts are stale
     * deliveries and leave the row unchanged.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE TransactionRefundEntity r
        SET r.refundedAmount = :amount, r.sellerRefundAmount = :sellerShare,
            r.chargeReference = :charge, r.updatedAt = :now
        WHERE r.transactionId = :id AND r.refundedAmount < :amount
        """)
    int raise(@Param("id") UUID transactionId,
              @Param("amount") long refundedAmount,
              @Param("sellerShare") long sellerRefundAmount,
              @Param("charge") String chargeReference,
              @Param("now") Instant now);
}
