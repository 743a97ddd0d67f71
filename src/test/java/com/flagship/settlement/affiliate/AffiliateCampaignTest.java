package com.flagship.settlement.affiliate;

import com.flagship.settlement.exception.SettlementErrorCode;
import com.flagship.settlement.exception.ValidationException;
import com.flagship.settlement.transaction.CurrencyCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AffiliateCampaignTest {

    @Test
    @DisplayName("10% of 5000 is 500")
    void percentageCommission() {
        assertEquals(500, percentage("10.00").commissionFor(5_000));
    }

    @Test
    void percentageCommissionRoundsHalfUp() {
        // 7.5% of 1010 = 75.75
        assertEquals(76, percentage("7.50").commissionFor(1_010));
        // 12.5% of 1004 = 125.5
        assertEquals(126, percentage("12.50").commissionFor(1_004));
        // 10% of 1004 = 100.4
        assertEquals(100, percentage("10.00").commissionFor(1_004));
    }

    @Test
    void fixedCommissionIgnoresPrice() {
        AffiliateCampaign campaign = campaign("fixed", null, 250L, null, 0);

        assertEquals(250, campaign.commissionFor(5_000));
        assertEquals(250, campaign.commissionFor(100));
    }

    @Test
    void fixedCampaignWithoutAmountYieldsZero() {
        assertEquals(0, campaign("FIXED", null, null, null, 0).commissionFor(5_000));
    }

    @Test
    void percentageCampaignWithoutRateIsInvalid() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> campaign("percentage", null, null, null, 0).commissionFor(5_000));
        assertEquals(SettlementErrorCode.INVALID_COMMISSION, e.getCode());
    }

    @ParameterizedTest
    @ValueSource(strings = {"tiered", "", "flat"})
    void unknownCommissionTypeIsRejected(String type) {
        ValidationException e = assertThrows(ValidationException.class,
                () -> campaign(type, new BigDecimal("10.00"), 100L, null, 0).commissionFor(5_000));
        assertEquals(SettlementErrorCode.UNSUPPORTED_COMMISSION_TYPE, e.getCode());
    }

    @Test
    void conversionLimit() {
        assertFalse(campaign("percentage", BigDecimal.TEN, null, null, 1_000).hasReachedConversionLimit());
        assertFalse(campaign("percentage", BigDecimal.TEN, null, 3, 2).hasReachedConversionLimit());
        assertTrue(campaign("percentage", BigDecimal.TEN, null, 3, 3).hasReachedConversionLimit());
    }

    @Test
    void conversionRequiresPositiveCommission() {
        AffiliateCampaign campaign = percentage("10.00");
        AffiliateClick click = new AffiliateClick(UUID.randomUUID(), campaign.getId(), campaign.getAffiliateId(),
                false, null, null);

        Conversion conversion = Conversion.record(click, campaign, UUID.randomUUID(), 500,
                CurrencyCode.USD);
        assertEquals(ConversionPayoutStatus.PENDING, conversion.getPayoutStatus());
        assertEquals(click.getId(), conversion.getClickId());
        assertEquals(campaign.getAffiliateId(), conversion.getAffiliateId());
        assertEquals(new BigDecimal("10.00"), conversion.getCommissionRate());

        assertThrows(IllegalArgumentException.class, () -> Conversion.record(click, campaign, UUID.randomUUID(), 0,
                CurrencyCode.USD));
    }

    private AffiliateCampaign percentage(String rate) {
        return campaign("percentage", new BigDecimal(rate), null, null, 0);
    }

    private AffiliateCampaign campaign(String type, BigDecimal rate, Long fixed, Integer max, int total) {
        return new AffiliateCampaign(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                type, rate, fixed, true, max, total);
    }
}
