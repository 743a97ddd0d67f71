package com.flagship.settlement.webhook.handler;

import com.flagship.settlement.transaction.TransactionLedger;
import com.flagship.settlement.webhook.ProviderEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Finds the payment reference a payment event is about and makes sure the
 * ledger knows it.
 *
 * A webhook can arrive before checkout has stored the provider's reference.
 * In that case the transaction id the intent was created with
 * ({@code metadata.transaction_id}) is used to bind the reference first.
 */
@Component
@RequiredArgsConstructor
@Slf4j
class PaymentReferenceResolver {

    static final String CHECKOUT_SESSION_COMPLETED = "checkout.session.completed";

    private final TransactionLedger ledger;

    String resolve(ProviderEvent event) {
        String reference = CHECKOUT_SESSION_COMPLETED.equals(event.getType())
            ? event.field("payment_intent")
            : event.getObjectId();
        if (reference == null) {
            throw new IllegalArgumentException("Event " + event.getId() + " carries no payment reference");
        }

        if (ledger.findByPaymentReference(reference).isEmpty()) {
            String transactionId = event.metadata("transaction_id");
            if (transactionId == null) {
                throw new IllegalArgumentException(
                    "No transaction for payment reference " + reference + " and no transaction_id metadata");
            }
            log.info("Binding payment reference {} to transaction {} from event {}",
                reference, transactionId, event.getId());
            ledger.bindPaymentReference(UUID.fromString(transactionId), reference);
        }
        return reference;
    }
}
