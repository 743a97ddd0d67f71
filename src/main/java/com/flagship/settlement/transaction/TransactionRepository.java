package com.flagship.settlement.transaction;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Transaction persistence.
 *
 * State changes are conditional updates guarded by the expected current
 * state. A return value of 0 means the precondition did not hold, and the
 * caller decides whether that is an idempotent repeat or a conflict.
 */
@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, UUID> {

    Optional<TransactionEntity> findByPaymentReference(String paymentReference);

    Optional<TransactionEntity> findByIdempotencyKey(String idempotencyKey);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE TransactionEntity t
        SET t.status = :target, t.failureReason = :reason, t.updatedAt = :now
        WHERE t.paymentReference = :reference AND t.status = :expected
        """)
    int transitionByReference(@Param("reference") String paymentReference,
                              @Param("expected") TransactionStatus expected,
                              @Param("target") TransactionStatus target,
                              @Param("reason") String reason,
                              @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE TransactionEntity t
        SET t.status = :target, t.failureReason = :reason, t.updatedAt = :now
        WHERE t.id = :id AND t.status = :expected
        """)
    int transitionById(@Param("id") UUID id,
                       @Param("expected") TransactionStatus expected,
                       @Param("target") TransactionStatus target,
                       @Param("reason") String reason,
                       @Param("now") Instant now);

    /**
     * Sets the provider reference only if none is set yet.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE TransactionEntity t
        SET t.paymentReference = :reference, t.updatedAt = :now
        WHERE t.id = :id AND t.paymentReference IS NULL
        """)
    int bindPaymentReference(@Param("id") UUID id,
                             @Param("reference") String paymentReference,
                             @Param("now") Instant now);

    List<TransactionEntity> findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(TransactionStatus status,
                                                                             Instant cutoff);
}
