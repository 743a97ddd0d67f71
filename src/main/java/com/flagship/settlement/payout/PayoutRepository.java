package com.flagship.settlement.payout;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PayoutRepository extends JpaRepository<PayoutEntity, UUID> {

    Optional<PayoutEntity> findByExternalPayoutId(String externalPayoutId);

    /**
     * Moves a PENDING payout to its reported outcome.
     *
     * @return 0 if the payout is unknown or no longer pending
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE PayoutEntity p
        SET p.status = :target, p.failureReason = :reason, p.updatedAt = :now
        WHERE p.externalPayoutId = :externalId
        AND p.status = com.flagship.settlement.payout.PayoutStatus.PENDING
        """)
    int settle(@Param("externalId") String externalPayoutId,
               @Param("target") PayoutStatus target,
               @Param("reason") String reason,
               @Param("now") Instant now);
}
