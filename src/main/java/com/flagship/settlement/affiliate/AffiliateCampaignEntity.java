package com.flagship.settlement.affiliate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Campaigns are created by the affiliate collaborator. The core reads them and
 * only ever increments {@code total_conversions}, through
 * {@link AffiliateCampaignRepository#incrementConversions}.
 */
@Entity
@Table(name = "affiliate_campaigns")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AffiliateCampaignEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "affiliate_id", nullable = false, updatable = false)
    private UUID affiliateId;

    @Column(name = "item_id", updatable = false)
    private UUID itemId;

    @Column(name = "commission_type", nullable = false, length = 20)
    private String commissionType;

    @Column(name = "commission_rate", precision = 5, scale = 2)
    private BigDecimal commissionRate;

    @Column(name = "fixed_commission_amount")
    private Long fixedCommissionAmount;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "max_conversions")
    private Integer maxConversions;

    @Column(name = "total_conversions", nullable = false)
    private int totalConversions;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public AffiliateCampaign toDomain() {
        return new AffiliateCampaign(
            id,
            affiliateId,
            itemId,
            commissionType,
            commissionRate,
            fixedCommissionAmount,
            active,
            maxConversions,
            totalConversions
        );
    }
}
