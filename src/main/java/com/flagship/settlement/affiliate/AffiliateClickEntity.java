package com.flagship.settlement.affiliate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Clicks are written by the click-tracking collaborator. {@code converted} is
 * a one-way latch set by {@link AffiliateClickRepository#markConverted}.
 */
@Entity
@Table(name = "affiliate_clicks")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AffiliateClickEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "campaign_id", nullable = false, updatable = false)
    private UUID campaignId;

    @Column(name = "affiliate_id", nullable = false, updatable = false)
    private UUID affiliateId;

    @Column(nullable = false)
    private boolean converted;

    @Column(name = "conversion_id")
    private UUID conversionId;

    @Column(name = "converted_at")
    private Instant convertedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public AffiliateClick toDomain() {
        return new AffiliateClick(id, campaignId, affiliateId, converted, conversionId, convertedAt);
    }
}
