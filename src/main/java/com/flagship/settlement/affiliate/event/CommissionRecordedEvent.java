package com.flagship.settlement.affiliate.event;

import com.flagship.settlement.affiliate.Conversion;
import com.flagship.settlement.outbox.SettlementEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class CommissionRecordedEvent implements SettlementEvent {
    public static final String EVENT_TYPE = "CommissionRecorded";

    UUID eventId;
    UUID conversionId;
    UUID clickId;
    UUID campaignId;
    UUID affiliateId;
    UUID transactionId;
    long commissionAmount;
    String currency;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CommissionRecordedEvent from(Conversion conversion) {
        return new CommissionRecordedEvent(
            UUID.randomUUID(),
            conversion.getId(),
            conversion.getClickId(),
            conversion.getCampaignId(),
            conversion.getAffiliateId(),
            conversion.getTransactionId(),
            conversion.getCommissionAmount(),
            conversion.getCurrency().name(),
            Instant.now()
        );
    }
}
