package com.flagship.settlement.affiliate;

import com.flagship.settlement.exception.ConflictException;
import com.flagship.settlement.exception.NotFoundException;
import com.flagship.settlement.exception.SettlementErrorCode;
import com.flagship.settlement.exception.ValidationException;
import com.flagship.settlement.fee.EarnerCategory;
import com.flagship.settlement.observability.SettlementMetrics;
import com.flagship.settlement.reconciliation.AlertType;
import com.flagship.settlement.reconciliation.ReconciliationAlertService;
import com.flagship.settlement.transaction.CurrencyCode;
import com.flagship.settlement.transaction.Transaction;
import com.flagship.settlement.transaction.TransactionLedger;
import com.flagship.settlement.transaction.TransactionStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CommissionEngineTest {

    @Mock
    private AffiliatePersistenceService persistence;
    @Mock
    private TransactionLedger ledger;
    @Mock
    private ReconciliationAlertService alertService;

    private SimpleMeterRegistry registry;
    private CommissionEngine engine;

    private final UUID affiliateId = UUID.randomUUID();
    private final UUID campaignId = UUID.randomUUID();
    private final UUID clickId = UUID.randomUUID();
    private final UUID transactionId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        engine = new CommissionEngine(persistence, ledger, new SettlementMetrics(registry), alertService);
    }

    @Nested
    @DisplayName("Recording a commission")
    class Recording {

        @Test
        @DisplayName("10% campaign on a 5000 sale records a 500 commission")
        void recordsPercentageCommission() {
            stubHappyPath(campaign("percentage", new BigDecimal("10.00"), null, true, null, 0), 5_000);

            CommissionResult result = engine.calculateCommission(clickId, transactionId);

            assertEquals(500, result.getCommissionAmount());
            assertEquals(new BigDecimal("10.00"), result.getCommissionRate());
            assertEquals(CurrencyCode.USD, result.getCurrency());
            assertEquals(ConversionPayoutStatus.PENDING, result.getPayoutStatus());

            ArgumentCaptor<Conversion> saved = ArgumentCaptor.forClass(Conversion.class);
            verify(persistence).recordConversion(saved.capture());
            assertEquals(clickId, saved.getValue().getClickId());
            assertEquals(affiliateId, saved.getValue().getAffiliateId());
            assertEquals(transactionId, saved.getValue().getTransactionId());
            verify(persistence).markClickConverted(clickId, result.getConversionId());
            verify(persistence).incrementCampaignConversions(campaignId);
            assertEquals(1.0, registry.counter("settlement.commission", "outcome", "recorded").count());
        }

        @Test
        void recordsFixedCommission() {
            stubHappyPath(campaign("fixed", null, 250L, true, 10, 3), 5_000);

            assertEquals(250, engine.calculateCommission(clickId, transactionId).getCommissionAmount());
        }

        @Test
        @DisplayName("Failure linking the click does not undo the commission")
        void secondaryFailuresAreNotFatal() {
            stubHappyPath(campaign("percentage", new BigDecimal("10.00"), null, true, null, 0), 5_000);
            when(persistence.markClickConverted(eq(clickId), any())).thenThrow(new QueryTimeoutException("timeout"));
            when(persistence.incrementCampaignConversions(campaignId)).thenReturn(false);

            CommissionResult result = engine.calculateCommission(clickId, transactionId);

            assertEquals(500, result.getCommissionAmount());
            assertEquals(1.0, registry.counter("settlement.secondary_effect.failed", "effect", "click_link").count());
            assertEquals(1.0, registry.counter("settlement.secondary_effect.failed", "effect", "campaign_counter").count());
        }

        @Test
        @DisplayName("Conversion that lands after the campaign hit its cap is raised for an operator")
        void overCapConversionRaisesAlert() {
            stubHappyPath(campaign("percentage", new BigDecimal("10.00"), null, true, 5, 4), 5_000);
            when(persistence.incrementCampaignConversions(campaignId)).thenReturn(false);

            CommissionResult result = engine.calculateCommission(clickId, transactionId);

            verify(alertService).raise(eq(AlertType.CONVERSION_OVER_CAP),
                    eq(result.getConversionId().toString()), contains(campaignId.toString()));
        }

        @Test
        void counterIncrementWithinCapRaisesNoAlert() {
            stubHappyPath(campaign("percentage", new BigDecimal("10.00"), null, true, 5, 2), 5_000);

            engine.calculateCommission(clickId, transactionId);

            verifyNoInteractions(alertService);
        }
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("Second conversion of the same click is ALREADY_CONVERTED")
        void alreadyConvertedClick() {
            UUID conversionId = UUID.randomUUID();
            when(persistence.findClick(clickId)).thenReturn(Optional.of(
                    new AffiliateClick(clickId, campaignId, affiliateId, true, conversionId, Instant.now())));

            ConflictException e = assertThrows(ConflictException.class,
                    () -> engine.calculateCommission(clickId, transactionId));

            assertEquals(SettlementErrorCode.ALREADY_CONVERTED, e.getCode());
            assertTrue(e.getMessage().contains(conversionId.toString()));
            verify(persistence, never()).recordConversion(any());
            assertEquals(1.0, registry.counter("settlement.commission", "outcome", "already_converted").count());
        }

        @Test
        @DisplayName("Losing a concurrent race on the click is ALREADY_CONVERTED")
        void uniqueViolationIsAlreadyConverted() {
            stubUpToInsert(campaign("percentage", new BigDecimal("10.00"), null, true, null, 0), 5_000);
            UUID winner = UUID.randomUUID();
            when(persistence.recordConversion(any())).thenThrow(new DataIntegrityViolationException("uq_click"));
            when(persistence.findConversionByClick(clickId)).thenReturn(Optional.of(new Conversion(winner, clickId,
                    campaignId, affiliateId, transactionId, 500, BigDecimal.TEN, CurrencyCode.USD,
                    ConversionPayoutStatus.PENDING, Instant.now())));

            ConflictException e = assertThrows(ConflictException.class,
                    () -> engine.calculateCommission(clickId, transactionId));

            assertEquals(SettlementErrorCode.ALREADY_CONVERTED, e.getCode());
            assertTrue(e.getMessage().contains(winner.toString()));
            verify(persistence, never()).markClickConverted(any(), any());
        }

        @Test
        void inactiveCampaign() {
            stubClick();
            when(persistence.findCampaign(campaignId)).thenReturn(Optional.of(
                    campaign("percentage", BigDecimal.TEN, null, false, null, 0)));

            ConflictException e = assertThrows(ConflictException.class,
                    () -> engine.calculateCommission(clickId, transactionId));
            assertEquals(SettlementErrorCode.CAMPAIGN_INACTIVE, e.getCode());
        }

        @Test
        void conversionCapReached() {
            stubClick();
            when(persistence.findCampaign(campaignId)).thenReturn(Optional.of(
                    campaign("percentage", BigDecimal.TEN, null, true, 5, 5)));

            ConflictException e = assertThrows(ConflictException.class,
                    () -> engine.calculateCommission(clickId, transactionId));
            assertEquals(SettlementErrorCode.CONVERSION_LIMIT_REACHED, e.getCode());
        }

        @Test
        void transactionNotSucceeded() {
            stubClick();
            when(persistence.findCampaign(campaignId)).thenReturn(Optional.of(
                    campaign("percentage", BigDecimal.TEN, null, true, null, 0)));
            when(ledger.findById(transactionId)).thenReturn(Optional.of(transaction(TransactionStatus.PENDING, 5_000)));

            ConflictException e = assertThrows(ConflictException.class,
                    () -> engine.calculateCommission(clickId, transactionId));
            assertEquals(SettlementErrorCode.TRANSACTION_NOT_SUCCEEDED, e.getCode());
        }

        @Test
        void commissionAboveGrossIsInvalid() {
            stubUpToInsert(campaign("fixed", null, 6_000L, true, null, 0), 5_000);

            ValidationException e = assertThrows(ValidationException.class,
                    () -> engine.calculateCommission(clickId, transactionId));
            assertEquals(SettlementErrorCode.INVALID_COMMISSION, e.getCode());
            verify(persistence, never()).recordConversion(any());
        }

        @Test
        void zeroCommissionIsInvalid() {
            stubUpToInsert(campaign("percentage", new BigDecimal("0.00"), null, true, null, 0), 5_000);

            ValidationException e = assertThrows(ValidationException.class,
                    () -> engine.calculateCommission(clickId, transactionId));
            assertEquals(SettlementErrorCode.INVALID_COMMISSION, e.getCode());
        }

        @Test
        void unknownClick() {
            when(persistence.findClick(clickId)).thenReturn(Optional.empty());

            assertThrows(NotFoundException.class, () -> engine.calculateCommission(clickId, transactionId));
        }
    }

    private void stubClick() {
        when(persistence.findClick(clickId)).thenReturn(Optional.of(
                new AffiliateClick(clickId, campaignId, affiliateId, false, null, null)));
    }

    private void stubUpToInsert(AffiliateCampaign campaign, long gross) {
        stubClick();
        when(persistence.findCampaign(campaignId)).thenReturn(Optional.of(campaign));
        when(ledger.findById(transactionId)).thenReturn(Optional.of(transaction(TransactionStatus.SUCCEEDED, gross)));
    }

    private void stubHappyPath(AffiliateCampaign campaign, long gross) {
        stubUpToInsert(campaign, gross);
        when(persistence.recordConversion(any(Conversion.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(persistence.markClickConverted(eq(clickId), any())).thenReturn(true);
        lenient().when(persistence.incrementCampaignConversions(campaignId)).thenReturn(true);
    }

    private AffiliateCampaign campaign(String type, BigDecimal rate, Long fixed, boolean active,
                                       Integer max, int total) {
        return new AffiliateCampaign(campaignId, affiliateId, UUID.randomUUID(), type, rate, fixed,
                active, max, total);
    }

    private Transaction transaction(TransactionStatus status, long gross) {
        Instant now = Instant.now();
        return new Transaction(transactionId, UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), gross,
                CurrencyCode.USD, 0, 0, gross, EarnerCategory.VENDOR, status, false, "pi_1", clickId, null, now, now);
    }
}
