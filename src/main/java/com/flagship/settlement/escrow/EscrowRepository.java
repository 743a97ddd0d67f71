package com.flagship.settlement.escrow;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EscrowRepository extends JpaRepository<EscrowEntity, UUID> {

    Optional<EscrowEntity> findByTransactionId(UUID transactionId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE EscrowEntity e
        SET e.status = com.flagship.settlement.escrow.EscrowStatus.RELEASED,
            e.releasedBy = :actor, e.releasedAt = :now, e.updatedAt = :now
        WHERE e.id = :id AND e.status = :expected
        """)
    int release(@Param("id") UUID id,
                @Param("expected") EscrowStatus expected,
                @Param("actor") UUID actor,
                @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE EscrowEntity e
        SET e.status = com.flagship.settlement.escrow.EscrowStatus.DISPUTED,
            e.disputedBy = :actor, e.disputedAt = :now, e.updatedAt = :now
        WHERE e.id = :id AND e.status = com.flagship.settlement.escrow.EscrowStatus.HELD
        """)
    int openDispute(@Param("id") UUID id,
                    @Param("actor") UUID actor,
                    @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE EscrowEntity e
        SET e.transferReference = :transfer, e.updatedAt = :now
        WHERE e.id = :id
        AND e.status = com.flagship.settlement.escrow.EscrowStatus.RELEASED
        AND e.transferReference IS NULL
        """)
    int recordTransfer(@Param("id") UUID id,
                       @Param("transfer") String transferReference,
                       @Param("now") Instant now);
}
