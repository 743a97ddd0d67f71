package com.flagship.settlement.consumer;

import com.flagship.settlement.affiliate.CommissionEngine;
import com.flagship.settlement.affiliate.CommissionResult;
import com.flagship.settlement.exception.ConflictException;
import com.flagship.settlement.exception.NotFoundException;
import com.flagship.settlement.exception.ValidationException;
import com.flagship.settlement.transaction.event.TransactionSucceededEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Records the affiliate commission for a referred purchase once its payment
 * has succeeded.
 *
 * Rejections from the commission engine (click already converted, campaign
 * inactive or capped, commission out of bounds, click unknown) are final for
 * this event: they are logged and the event counts as handled.
 */
@Service
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class CommissionAttributionHandler {

    private final CommissionEngine commissionEngine;

    public void onTransactionSucceeded(TransactionSucceededEvent event) {
        if (event.getAffiliateClickId() == null) {
            return;
        }

        try {
            CommissionResult result = commissionEngine.calculateCommission(
                event.getAffiliateClickId(), event.getTransactionId());
            log.info("Attributed transaction {} to click {}: conversion {} commission {}",
                    event.getTransactionId(), event.getAffiliateClickId(),
                    result.getConversionId(), result.getCommissionAmount());
        } catch (ConflictException | ValidationException | NotFoundException e) {
            log.warn("No commission for transaction {} and click {}: {} ({})",
                    event.getTransactionId(), event.getAffiliateClickId(), e.getMessage(), e.getCode());
        }
    }
}
