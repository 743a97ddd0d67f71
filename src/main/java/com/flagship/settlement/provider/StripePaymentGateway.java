package com.flagship.settlement.provider;

import com.flagship.settlement.config.SettlementProperties;
import com.flagship.settlement.exception.ExternalServiceException;
import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.StripeException;
import com.stripe.model.PaymentIntent;
import com.stripe.model.Payout;
import com.stripe.model.Transfer;
import com.stripe.net.RequestOptions;
import com.stripe.param.PaymentIntentCreateParams;
import com.stripe.param.PayoutCreateParams;
import com.stripe.param.TransferCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * Stripe implementation of the provider gateway.
 *
 * Credentials and timeouts are passed per request through
 * {@link RequestOptions} rather than the global {@code Stripe.apiKey}.
 * Network failures surface as timeouts; API errors as provider refusals.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StripePaymentGateway implements PaymentProviderGateway {

    private final SettlementProperties properties;

    @Override
    public PaymentIntentResult createPaymentIntent(PaymentIntentRequest request) {
        PaymentIntentCreateParams.Builder params = PaymentIntentCreateParams.builder()
            .setAmount(request.getAmount())
            .setCurrency(request.getCurrency().toProviderCode())
            .putAllMetadata(request.getMetadata() != null ? request.getMetadata() : Map.of())
            .setAutomaticPaymentMethods(
                PaymentIntentCreateParams.AutomaticPaymentMethods.builder()
                    .setEnabled(true)
                    .build());

        if (request.getPaymentMethodRef() != null) {
            params.setPaymentMethod(request.getPaymentMethodRef());
        }

        params.setTransferGroup(transferGroup(request.getTransactionId()));
        if (!request.isUsesEscrow()) {
            // The seller receives exactly the ledger's seller net
            params.setTransferData(PaymentIntentCreateParams.TransferData.builder()
                .setDestination(request.getDestinationAccountId())
                .setAmount(request.getSellerNet())
                .build());
        }

        try {
            PaymentIntent intent = PaymentIntent.create(params.build(), options(request.getIdempotencyKey(), null));
            log.info("Created payment intent {} for transaction {} (status={})",
                    intent.getId(), request.getTransactionId(), intent.getStatus());
            return new PaymentIntentResult(intent.getId(), intent.getClientSecret(), intent.getStatus());
        } catch (StripeException e) {
            throw translate("create payment intent for transaction " + request.getTransactionId(), e);
        }
    }

    @Override
    public String retrieveClientSecret(String paymentReference) {
        try {
            return PaymentIntent.retrieve(paymentReference, options(null, null)).getClientSecret();
        } catch (StripeException e) {
            throw translate("retrieve payment intent " + paymentReference, e);
        }
    }

    @Override
    public PayoutResult createPayout(PayoutRequest request) {
        PayoutCreateParams params = PayoutCreateParams.builder()
            .setAmount(request.getAmount())
            .setCurrency(request.getCurrency().toProviderCode())
            .setStatementDescriptor(properties.getProvider().getPayoutStatementDescriptor())
            .putMetadata("payout_id", request.getPayoutId().toString())
            .putMetadata("seller_id", request.getSellerId().toString())
            .build();

        try {
            // Payout id doubles as the provider idempotency key
            Payout payout = Payout.create(params,
                options("payout-" + request.getPayoutId(), request.getDestinationAccountId()));
            log.info("Created provider payout {} for seller {} amount={}",
                    payout.getId(), request.getSellerId(), request.getAmount());
            return new PayoutResult(payout.getId(), payout.getStatus());
        } catch (StripeException e) {
            throw translate("create payout " + request.getPayoutId(), e);
        }
    }

    @Override
    public TransferResult createTransfer(TransferRequest request) {
        TransferCreateParams params = TransferCreateParams.builder()
            .setAmount(request.getAmount())
            .setCurrency(request.getCurrency().toProviderCode())
            .setDestination(request.getDestinationAccountId())
            .setTransferGroup(transferGroup(request.getTransactionId()))
            .putMetadata("escrow_id", request.getEscrowId().toString())
            .putMetadata("transaction_id", request.getTransactionId().toString())
            .build();

        try {
            Transfer transfer = Transfer.create(params, options("escrow-release-" + request.getEscrowId(), null));
            log.info("Created transfer {} of {} for escrow {} to seller {}",
                    transfer.getId(), request.getAmount(), request.getEscrowId(), request.getSellerId());
            return new TransferResult(transfer.getId());
        } catch (StripeException e) {
            throw translate("transfer escrow " + request.getEscrowId(), e);
        }
    }

    static String transferGroup(UUID transactionId) {
        return "txn_" + transactionId;
    }

    private RequestOptions options(String idempotencyKey, String connectedAccount) {
        SettlementProperties.Provider provider = properties.getProvider();
        RequestOptions.RequestOptionsBuilder builder = RequestOptions.builder()
            .setApiKey(provider.getApiKey())
            .setConnectTimeout(provider.getConnectTimeoutMs())
            .setReadTimeout(provider.getReadTimeoutMs())
            .setMaxNetworkRetries(0);
        if (idempotencyKey != null) {
            builder.setIdempotencyKey(idempotencyKey);
        }
        if (connectedAccount != null) {
            builder.setStripeAccount(connectedAccount);
        }
        return builder.build();
    }

    private ExternalServiceException translate(String action, StripeException e) {
        boolean timeout = e instanceof ApiConnectionException;
        log.error("Stripe failed to {} (timeout={}, code={}, requestId={}): {}",
                action, timeout, e.getCode(), e.getRequestId(), e.getMessage());
        return new ExternalServiceException("Payment provider failed to " + action, timeout, e);
    }
}
