package com.flagship.settlement.affiliate;

import com.flagship.settlement.transaction.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A recorded commission. At most one exists per click.
 */
@Value
public class Conversion {
    UUID id;
    UUID clickId;
    UUID campaignId;
    UUID affiliateId;
    UUID transactionId;
    long commissionAmount;
    BigDecimal commissionRate;
    CurrencyCode currency;
    ConversionPayoutStatus payoutStatus;
    Instant createdAt;

    public static Conversion record(AffiliateClick click, AffiliateCampaign campaign,
                                    UUID transactionId, long commissionAmount, CurrencyCode currency) {
        if (commissionAmount <= 0) {
            throw new IllegalArgumentException("Commission must be positive: " + commissionAmount);
        }
        return new Conversion(
            UUID.randomUUID(),
            click.getId(),
            campaign.getId(),
            click.getAffiliateId(),
            transactionId,
            commissionAmount,
            campaign.getCommissionRate(),
            currency,
            ConversionPayoutStatus.PENDING,
            Instant.now()
        );
    }
}
