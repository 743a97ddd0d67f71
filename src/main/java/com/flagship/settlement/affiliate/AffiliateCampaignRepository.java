package com.flagship.settlement.affiliate;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface AffiliateCampaignRepository extends JpaRepository<AffiliateCampaignEntity, UUID> {

    /**
     * Adds one conversion unless the campaign cap is already reached.
     *
     * @return 1 if incremented, 0 if the campaign is missing or at its cap
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE AffiliateCampaignEntity c
        SET c.totalConversions = c.totalConversions + 1, c.updatedAt = :now
        WHERE c.id = :id
        AND (c.maxConversions IS NULL OR c.totalConversions < c.maxConversions)
        """)
    int incrementConversions(@Param("id") UUID campaignId, @Param("now") Instant now);
}
