package com.flagship.settlement.affiliate;

import com.flagship.settlement.exception.ConflictException;
import com.flagship.settlement.exception.NotFoundException;
import com.flagship.settlement.exception.SettlementErrorCode;
import com.flagship.settlement.exception.SettlementException;
import com.flagship.settlement.exception.ValidationException;
import com.flagship.settlement.observability.CorrelationContext;
import com.flagship.settlement.observability.SettlementMetrics;
import com.flagship.settlement.reconciliation.AlertType;
import com.flagship.settlement.reconciliation.ReconciliationAlertService;
import com.flagship.settlement.transaction.Transaction;
import com.flagship.settlement.transaction.TransactionLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.UUID;

/**
 * Turns an affiliate click plus a succeeded transaction into a commission.
 *
 * Only the conversion insert is fatal. Marking the click converted and
 * bumping the campaign counter happen afterwards in their own transactions;
 * when they fail the conversion stands, and the failure is logged and counted.
 * A counter refused at the campaign cap means a concurrent conversion got past
 * the limit check; that conversion is raised as a reconciliation alert.
 * The unique click id on conversions makes a second conversion for the same
 * click fail with ALREADY_CONVERTED even if two calls race past the
 * {@code converted} check.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommissionEngine {

    private final AffiliatePersistenceService persistence;
    private final TransactionLedger ledger;
    private final SettlementMetrics metrics;
    private final ReconciliationAlertService alertService;

    public CommissionResult calculateCommission(UUID clickId, UUID transactionId) {
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transactionId.toString());
        try {
            CommissionResult result = doCalculate(clickId, transactionId);
            metrics.recordCommission("recorded");
            return result;
        } catch (SettlementException e) {
            metrics.recordCommission(e.getCode().name().toLowerCase(Locale.ROOT));
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private CommissionResult doCalculate(UUID clickId, UUID transactionId) {
        AffiliateClick click = persistence.findClick(clickId)
            .orElseThrow(() -> NotFoundException.of("Click", clickId));
        if (click.isConverted()) {
            throw alreadyConverted(click.getId(), click.getConversionId());
        }

        AffiliateCampaign campaign = persistence.findCampaign(click.getCampaignId())
            .orElseThrow(() -> NotFoundException.of("Campaign", click.getCampaignId()));
        if (!campaign.isActive()) {
            throw new ConflictException(SettlementErrorCode.CAMPAIGN_INACTIVE,
                "Campaign " + campaign.getId() + " is not active");
        }
        if (campaign.hasReachedConversionLimit()) {
            throw new ConflictException(SettlementErrorCode.CONVERSION_LIMIT_REACHED, String.format(
                "Campaign %s has reached its limit of %d conversions",
                campaign.getId(), campaign.getMaxConversions()));
        }

        Transaction transaction = ledger.findById(transactionId)
            .orElseThrow(() -> NotFoundException.of("Transaction", transactionId));
        if (!transaction.isSucceeded()) {
            throw new ConflictException(SettlementErrorCode.TRANSACTION_NOT_SUCCEEDED, String.format(
                "Transaction %s is %s, commission requires a succeeded transaction",
                transactionId, transaction.getStatus()));
        }

        long commission = campaign.commissionFor(transaction.getGrossAmount());
        if (commission <= 0 || commission > transaction.getGrossAmount()) {
            throw new ValidationException(SettlementErrorCode.INVALID_COMMISSION, String.format(
                "Commission %d is outside (0, %d] for transaction %s",
                commission, transaction.getGrossAmount(), transactionId));
        }

        Conversion conversion;
        try {
            conversion = persistence.recordConversion(Conversion.record(
                click, campaign, transactionId, commission, transaction.getCurrency()));
        } catch (DataIntegrityViolationException e) {
            log.info("Click {} converted concurrently, rejecting duplicate commission", clickId);
            UUID existing = persistence.findConversionByClick(clickId).map(Conversion::getId).orElse(null);
            throw alreadyConverted(clickId, existing);
        }

        log.info("Recorded commission {} of {} {} for click {} on transaction {}",
            conversion.getId(), commission, conversion.getCurrency(), clickId, transactionId);

        linkClick(clickId, conversion.getId());
        countConversion(campaign.getId(), conversion.getId());

        return CommissionResult.from(conversion);
    }

    private void linkClick(UUID clickId, UUID conversionId) {
        try {
            if (!persistence.markClickConverted(clickId, conversionId)) {
                log.warn("Click {} was already marked converted when linking conversion {}", clickId, conversionId);
            }
        } catch (RuntimeException e) {
            metrics.recordSecondaryEffectFailure("click_link");
            log.warn("Failed to mark click {} converted for conversion {}: {}",
                clickId, conversionId, e.getMessage(), e);
        }
    }

    private void countConversion(UUID campaignId, UUID conversionId) {
        try {
            if (!persistence.incrementCampaignConversions(campaignId)) {
                metrics.recordSecondaryEffectFailure("campaign_counter");
                alertService.raise(AlertType.CONVERSION_OVER_CAP, conversionId.toString(), String.format(
                    "Conversion %s was recorded after campaign %s reached its conversion cap",
                    conversionId, campaignId));
            }
        } catch (RuntimeException e) {
            metrics.recordSecondaryEffectFailure("campaign_counter");
            log.warn("Failed to increment conversions of campaign {} for conversion {}: {}",
                campaignId, conversionId, e.getMessage(), e);
        }
    }

    private static ConflictException alreadyConverted(UUID clickId, UUID conversionId) {
        return new ConflictException(SettlementErrorCode.ALREADY_CONVERTED,
            "Click " + clickId + " already converted" + (conversionId != null ? " as " + conversionId : ""));
    }
}
