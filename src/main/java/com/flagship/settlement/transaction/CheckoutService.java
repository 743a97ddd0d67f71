package com.flagship.settlement.transaction;

import com.flagship.settlement.catalog.CatalogItem;
import com.flagship.settlement.catalog.ItemCatalog;
import com.flagship.settlement.catalog.SellerAccountDirectory;
import com.flagship.settlement.catalog.SellerPayoutAccount;
import com.flagship.settlement.exception.ExternalServiceException;
import com.flagship.settlement.exception.NotFoundException;
import com.flagship.settlement.exception.SettlementErrorCode;
import com.flagship.settlement.exception.ValidationException;
import com.flagship.settlement.observability.CorrelationContext;
import com.flagship.settlement.observability.SettlementMetrics;
import com.flagship.settlement.provider.PaymentIntentRequest;
import com.flagship.settlement.provider.PaymentIntentResult;
import com.flagship.settlement.provider.PaymentProviderGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Buyer checkout: validates the purchase, records a PENDING transaction and
 * opens a payment intent at the provider.
 *
 * Order of effects:
 * <ol>
 *   <li>replayed idempotency keys return the original transaction</li>
 *   <li>the transaction (and escrow) is committed before the provider call</li>
 *   <li>a provider failure or timeout marks that transaction FAILED</li>
 *   <li>the provider reference is bound so webhooks can find the row</li>
 * </ol>
 * Not transactional as a whole: the provider call must not run inside an
 * open database transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CheckoutService {

    private final TransactionLedger ledger;
    private final ItemCatalog itemCatalog;
    private final SellerAccountDirectory sellerAccounts;
    private final PaymentProviderGateway gateway;
    private final IdempotencyService idempotencyService;
    private final SettlementMetrics metrics;

    public CheckoutResult checkout(CheckoutCommand command) {
        var existing = idempotencyService.findTransactionId(command.getIdempotencyKey());
        if (existing.isPresent()) {
            metrics.recordIdempotencyHit();
            log.info("Checkout idempotency key already used, returning transaction {}", existing.get());
            return replay(existing.get());
        }
        metrics.recordIdempotencyMiss();

        CatalogItem item = itemCatalog.findItem(command.getItemId())
            .orElseThrow(() -> NotFoundException.of("Item", command.getItemId()));

        SellerPayoutAccount sellerAccount = sellerAccounts.findBySellerId(item.getSellerId())
            .filter(SellerPayoutAccount::isChargesEnabled)
            .orElseThrow(() -> new ValidationException(SettlementErrorCode.NO_PAYOUT_DESTINATION,
                "Seller " + item.getSellerId() + " cannot accept payments yet"));

        Transaction transaction;
        try {
            transaction = ledger.create(new NewTransaction(
                command.getBuyerId(),
                item,
                command.isUsesEscrow(),
                command.getIdempotencyKey(),
                command.getAffiliateClickId()
            ));
        } catch (DataIntegrityViolationException e) {
            // A concurrent request with the same key inserted first
            Transaction winner = ledger.findByIdempotencyKey(command.getIdempotencyKey()).orElseThrow(() -> e);
            metrics.recordIdempotencyHit();
            return replay(winner.getId());
        }

        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transaction.getId().toString());
        try {
            PaymentIntentResult intent;
            try {
                intent = gateway.createPaymentIntent(intentRequest(transaction, sellerAccount, command));
            } catch (ExternalServiceException e) {
                String reason = e.isTimeout() ? "provider_timeout" : "provider_error";
                ledger.failUnconfirmed(transaction.getId(), reason);
                metrics.recordCheckout(reason);
                throw e;
            }

            Transaction bound = ledger.bindPaymentReference(transaction.getId(), intent.getPaymentReference());
            idempotencyService.remember(command.getIdempotencyKey(), bound.getId());
            metrics.recordCheckout("created");

            log.info("Checkout created transaction {} with payment reference {}",
                bound.getId(), bound.getPaymentReference());
            return new CheckoutResult(bound, intent.getClientSecret(), false);
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private CheckoutResult replay(UUID transactionId) {
        Transaction transaction = ledger.findById(transactionId)
            .orElseThrow(() -> new IllegalStateException(
                "Transaction found by idempotency key but not by id: " + transactionId));

        String clientSecret = null;
        if (transaction.getStatus() == TransactionStatus.PENDING && transaction.getPaymentReference() != null) {
            clientSecret = gateway.retrieveClientSecret(transaction.getPaymentReference());
        }
        metrics.recordCheckout("replayed");
        return new CheckoutResult(transaction, clientSecret, true);
    }

    private PaymentIntentRequest intentRequest(Transaction transaction, SellerPayoutAccount sellerAccount,
                                               CheckoutCommand command) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("transaction_id", transaction.getId().toString());
        metadata.put("item_id", transaction.getItemId().toString());
        metadata.put("buyer_id", transaction.getBuyerId().toString());
        metadata.put("seller_id", transaction.getSellerId().toString());
        metadata.put("uses_escrow", String.valueOf(transaction.isUsesEscrow()));
        metadata.put("earner_type", transaction.getEarnerCategory().name().toLowerCase());

        return PaymentIntentRequest.builder()
            .transactionId(transaction.getId())
            .amount(transaction.getGrossAmount())
            .currency(transaction.getCurrency())
            .paymentMethodRef(command.getPaymentMethodRef())
            .destinationAccountId(sellerAccount.getProviderAccountId())
            .sellerNet(transaction.getSellerNet())
            .usesEscrow(transaction.isUsesEscrow())
            .metadata(metadata)
            .idempotencyKey("checkout-" + transaction.getId())
            .build();
    }
}
