package com.flagship.settlement.webhook.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.settlement.payout.SellerBalanceQuery;
import com.flagship.settlement.reconciliation.AlertType;
import com.flagship.settlement.reconciliation.ReconciliationAlertService;
import com.flagship.settlement.transaction.Transaction;
import com.flagship.settlement.transaction.TransactionLedger;
import com.flagship.settlement.transaction.TransactionRefund;
import com.flagship.settlement.transaction.TransactionRefundService;
import com.flagship.settlement.webhook.ProviderEvent;
import com.flagship.settlement.webhook.WebhookEventHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * Records refunds of succeeded charges. The transaction stays SUCCEEDED.
 *
 * When the seller's share of the refund is more than they had left unpaid,
 * the money has already gone out in a payout and an operator has to recover it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChargeRefundedHandler implements WebhookEventHandler {

    private final TransactionRefundService refundService;
    private final TransactionLedger ledger;
    private final SellerBalanceQuery balanceQuery;
    private final ReconciliationAlertService alertService;

    @Override
    public Set<String> supportedEventTypes() {
        return Set.of("charge.refunded");
    }

    @Override
    public void handle(ProviderEvent event) {
        String paymentReference = event.field("payment_intent");
        JsonNode amountRefunded = event.getObject().path("amount_refunded");
        if (paymentReference == null || !amountRefunded.canConvertToLong()) {
            throw new IllegalArgumentException(
                "Refund event " + event.getId() + " has no payment_intent or amount_refunded");
        }

        Optional<TransactionRefund> recorded = refundService.recordRefund(
            paymentReference, event.getObjectId(), amountRefunded.asLong());
        if (recorded.isEmpty()) {
            return;
        }

        TransactionRefund refund = recorded.get();
        Transaction transaction = ledger.findById(refund.getTransactionId())
            .orElseThrow(() -> new IllegalStateException("Refunded transaction " + refund.getTransactionId() + " vanished"));
        long balance = balanceQuery.availableBalance(transaction.getSellerId(), refund.getCurrency());
        if (balance < 0) {
            alertService.raise(AlertType.REFUND_EXCEEDS_BALANCE, transaction.getId().toString(), String.format(
                "Refund of %d %s on transaction %s leaves seller %s with balance %d; %d was already paid out",
                refund.getRefundedAmount(), refund.getCurrency(), transaction.getId(),
                transaction.getSellerId(), balance, -balance));
        }
    }
}
