package com.flagship.settlement.affiliate;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface AffiliateClickRepository extends JpaRepository<AffiliateClickEntity, UUID> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE AffiliateClickEntity c
        SET c.converted = true, c.conversionId = :conversionId, c.convertedAt = :now
        WHERE c.id = :id AND c.converted = false
        """)
    int markConverted(@Param("id") UUID clickId,
                      @Param("conversionId") UUID conversionId,
                      @Param("now") Instant now);
}
