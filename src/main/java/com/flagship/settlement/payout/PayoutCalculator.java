package com.flagship.settlement.payout;

import com.flagship.settlement.catalog.SellerAccountDirectory;
import com.flagship.settlement.catalog.SellerPayoutAccount;
import com.flagship.settlement.config.SettlementProperties;
import com.flagship.settlement.exception.ExternalServiceException;
import com.flagship.settlement.exception.ReconciliationAlertException;
import com.flagship.settlement.exception.SettlementErrorCode;
import com.flagship.settlement.exception.ValidationException;
import com.flagship.settlement.observability.CorrelationContext;
import com.flagship.settlement.observability.SettlementMetrics;
import com.flagship.settlement.provider.PaymentProviderGateway;
import com.flagship.settlement.provider.PayoutRequest;
import com.flagship.settlement.provider.PayoutResult;
import com.flagship.settlement.reconciliation.AlertType;
import com.flagship.settlement.reconciliation.ReconciliationAlertService;
import com.flagship.settlement.transaction.CurrencyCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Seller balances and payouts.
 *
 * A payout request holds a row lock on the seller's payout account for the
 * whole operation, so two requests for the same seller see each other's
 * reservations. The provider is called before anything is written locally:
 * <ul>
 *   <li>provider refuses or times out: a FAILED payout is stored and the error surfaces</li>
 *   <li>provider accepts: a PENDING payout with the external id is stored</li>
 *   <li>provider accepts but the local write fails: a reconciliation alert is
 *       raised and the request is never sent again</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutCalculator {

    private final SellerAccountDirectory accountDirectory;
    private final SellerBalanceQuery balanceQuery;
    private final PayoutPersistenceService persistence;
    private final PaymentProviderGateway gateway;
    private final ReconciliationAlertService alertService;
    private final SettlementProperties properties;
    private final SettlementMetrics metrics;

    /**
     * Withdrawable balance in the payout currency, never below 0.
     */
    @Transactional(readOnly = true)
    public long availableBalance(UUID sellerId) {
        long balance = balanceQuery.availableBalance(sellerId, properties.getPayout().getCurrency());
        if (balance < 0) {
            log.error("Seller {} has negative available balance {}, reporting 0", sellerId, balance);
            return 0L;
        }
        return balance;
    }

    /**
     * Pays out {@code requestedAmount}, or the full available balance when null.
     *
     * @throws ValidationException NO_PAYOUT_DESTINATION, INVALID_OPERATION or INSUFFICIENT_BALANCE
     * @throws ExternalServiceException when the provider refuses or does not answer
     * @throws ReconciliationAlertException when the provider accepted but the payout could not be stored
     */
    @Transactional
    public Payout createPayout(UUID sellerId, Long requestedAmount) {
        SellerPayoutAccount account = accountDirectory.lockBySellerId(sellerId)
            .filter(SellerPayoutAccount::isPayoutsEnabled)
            .filter(a -> a.getProviderAccountId() != null && !a.getProviderAccountId().isBlank())
            .orElseThrow(() -> reject(new ValidationException(SettlementErrorCode.NO_PAYOUT_DESTINATION,
                "Seller " + sellerId + " has no payout destination configured")));

        if (requestedAmount != null && requestedAmount <= 0) {
            throw reject(new ValidationException(SettlementErrorCode.INVALID_OPERATION,
                "Payout amount must be positive, got " + requestedAmount));
        }

        long available = availableBalance(sellerId);
        long amount = requestedAmount != null ? requestedAmount : available;
        if (amount <= 0 || amount > available) {
            throw reject(new ValidationException(SettlementErrorCode.INSUFFICIENT_BALANCE, String.format(
                "Insufficient balance for seller %s: available %d, requested %d", sellerId, available, amount)));
        }

        UUID payoutId = UUID.randomUUID();
        CurrencyCode currency = properties.getPayout().getCurrency();
        MDC.put(CorrelationContext.PAYOUT_ID_MDC_KEY, payoutId.toString());
        try {
            PayoutResult result = requestPayout(payoutId, sellerId, account, amount, currency);
            Payout payout = Payout.accepted(payoutId, sellerId, amount, currency,
                account.getProviderAccountId(), result.getExternalPayoutId());

            try {
                Payout saved = persistence.recordAccepted(payout);
                metrics.recordPayout("created");
                log.info("Payout {} of {} {} created for seller {} (external id {})",
                    payoutId, amount, currency, sellerId, result.getExternalPayoutId());
                return saved;
            } catch (RuntimeException e) {
                metrics.recordPayout("not_recorded");
                String detail = String.format(
                    "Provider payout %s for seller %s amount %d %s was accepted but could not be recorded: %s",
                    result.getExternalPayoutId(), sellerId, amount, currency, e.getMessage());
                UUID alertId = alertService.raise(AlertType.PAYOUT_NOT_RECORDED, result.getExternalPayoutId(), detail);
                throw new ReconciliationAlertException(alertId, detail, e);
            }
        } finally {
            MDC.remove(CorrelationContext.PAYOUT_ID_MDC_KEY);
        }
    }

    /**
     * Applies a provider payout outcome. Unknown or already settled payouts are ignored.
     */
    public Optional<Payout> markCompleted(String externalPayoutId) {
        return settle(externalPayoutId, PayoutStatus.COMPLETED, null);
    }

    public Optional<Payout> markFailed(String externalPayoutId, String reason) {
        return settle(externalPayoutId, PayoutStatus.FAILED, reason);
    }

    private Optional<Payout> settle(String externalPayoutId, PayoutStatus target, String reason) {
        Optional<Payout> settled = persistence.settle(externalPayoutId, target, reason);
        if (settled.isPresent()) {
            metrics.recordPayout(target.name().toLowerCase(Locale.ROOT));
            log.info("Payout {} moved PENDING -> {}", settled.get().getId(), target);
        } else {
            log.info("Payout with external id {} unknown or already settled, ignoring {}", externalPayoutId, target);
        }
        return settled;
    }

    private PayoutResult requestPayout(UUID payoutId, UUID sellerId, SellerPayoutAccount account,
                                       long amount, CurrencyCode currency) {
        try {
            return gateway.createPayout(new PayoutRequest(
                payoutId, sellerId, account.getProviderAccountId(), amount, currency));
        } catch (ExternalServiceException e) {
            metrics.recordPayout(e.isTimeout() ? "provider_timeout" : "provider_error");
            log.warn("Provider refused payout {} for seller {}: {}", payoutId, sellerId, e.getMessage());
            try {
                persistence.recordRejected(Payout.rejected(payoutId, sellerId, amount, currency,
                    account.getProviderAccountId(), e.isTimeout() ? "provider_timeout" : e.getMessage()));
            } catch (RuntimeException persistFailure) {
                log.error("Could not store failed payout {}: {}", payoutId, persistFailure.getMessage(), persistFailure);
                e.addSuppressed(persistFailure);
            }
            throw e;
        }
    }

    private ValidationException reject(ValidationException e) {
        metrics.recordPayout(e.getCode().name().toLowerCase(Locale.ROOT));
        return e;
    }
}
