package com.flagship.settlement.affiliate;

import com.flagship.settlement.transaction.CurrencyCode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "affiliate_conversions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ConversionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "click_id", nullable = false, unique = true, updatable = false)
    private UUID clickId;

    @Column(name = "campaign_id", nullable = false, updatable = false)
    private UUID campaignId;

    @Column(name = "affiliate_id", nullable = false, updatable = false)
    private UUID affiliateId;

    @Column(name = "transaction_id", nullable = false, updatable = false)
    private UUID transactionId;

    @Column(name = "commission_amount", nullable = false, updatable = false)
    private long commissionAmount;

    @Column(name = "commission_rate", precision = 5, scale = 2, updatable = false)
    private BigDecimal commissionRate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private CurrencyCode currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "payout_status", nullable = false, length = 20)
    private ConversionPayoutStatus payoutStatus;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    static ConversionEntity fromDomain(Conversion conversion) {
        return new ConversionEntity(
            conversion.getId(),
            conversion.getClickId(),
            conversion.getCampaignId(),
            conversion.getAffiliateId(),
            conversion.getTransactionId(),
            conversion.getCommissionAmount(),
            conversion.getCommissionRate(),
            conversion.getCurrency(),
            conversion.getPayoutStatus(),
            conversion.getCreatedAt()
        );
    }

    public Conversion toDomain() {
        return new Conversion(
            id,
            clickId,
            campaignId,
            affiliateId,
            transactionId,
            commissionAmount,
            commissionRate,
            currency,
            payoutStatus,
            createdAt
        );
    }
}
