package com.flagship.settlement.affiliate;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class AffiliateClick {
    UUID id;
    UUID campaignId;
    UUID affiliateId;
    boolean converted;
    UUID conversionId;
    Instant convertedAt;
}
