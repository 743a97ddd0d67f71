package com.flagship.settlement.webhook.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.settlement.catalog.SellerAccountDirectory;
import com.flagship.settlement.fee.EarnerCategory;
import com.flagship.settlement.payout.PayoutCalculator;
import com.flagship.settlement.payout.SellerBalanceQuery;
import com.flagship.settlement.reconciliation.AlertType;
import com.flagship.settlement.reconciliation.ReconciliationAlertService;
import com.flagship.settlement.subscription.SubscriptionService;
import com.flagship.settlement.subscription.SubscriptionStatus;
import com.flagship.settlement.subscription.SubscriptionUpdate;
import com.flagship.settlement.transaction.CurrencyCode;
import com.flagship.settlement.transaction.Transaction;
import com.flagship.settlement.transaction.TransactionLedger;
import com.flagship.settlement.transaction.TransactionRefund;
import com.flagship.settlement.transaction.TransactionRefundService;
import com.flagship.settlement.transaction.TransactionStatus;
import com.flagship.settlement.webhook.ProviderEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProviderEventHandlersTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private TransactionLedger ledger;
    @Mock
    private PayoutCalculator payoutCalculator;
    @Mock
    private SubscriptionService subscriptionService;
    @Mock
    private SellerAccountDirectory accountDirectory;
    @Mock
    private TransactionRefundService refundService;
    @Mock
    private SellerBalanceQuery balanceQuery;
    @Mock
    private ReconciliationAlertService alertService;

    private final Transaction known = new Transaction(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
            UUID.randomUUID(), 10_000, CurrencyCode.USD, 1_200, 320, 8_480, EarnerCategory.VENDOR,
            TransactionStatus.PENDING, false, "pi_1", null, null, Instant.now(), Instant.now());

    @Nested
    @DisplayName("payment events")
    class PaymentEvents {

        @Test
        void paymentIntentSucceededMarksTransaction() {
            when(ledger.findByPaymentReference("pi_1")).thenReturn(Optional.of(known));

            succeededHandler().handle(event("payment_intent.succeeded", "{\"id\":\"pi_1\"}"));

            verify(ledger).markSucceeded("pi_1");
        }

        @Test
        void checkoutSessionUsesItsPaymentIntent() {
            when(ledger.findByPaymentReference("pi_7")).thenReturn(Optional.of(known));

            succeededHandler().handle(event("checkout.session.completed",
                    "{\"id\":\"cs_1\",\"payment_intent\":\"pi_7\"}"));

            verify(ledger).markSucceeded("pi_7");
        }

        @Test
        @DisplayName("Webhook ahead of checkout binds the reference from metadata first")
        void unknownReferenceIsBoundFromMetadata() {
            UUID transactionId = UUID.randomUUID();
            when(ledger.findByPaymentReference("pi_2")).thenReturn(Optional.empty());

            succeededHandler().handle(event("payment_intent.succeeded",
                    "{\"id\":\"pi_2\",\"metadata\":{\"transaction_id\":\"" + transactionId + "\"}}"));

            verify(ledger).bindPaymentReference(transactionId, "pi_2");
            verify(ledger).markSucceeded("pi_2");
        }

        @Test
        void unknownReferenceWithoutMetadataFails() {
            when(ledger.findByPaymentReference("pi_3")).thenReturn(Optional.empty());

            assertThrows(IllegalArgumentException.class, () ->
                    succeededHandler().handle(event("payment_intent.succeeded", "{\"id\":\"pi_3\"}")));
            verify(ledger, never()).markSucceeded(any());
        }

        @Test
        void paymentFailureCarriesProviderMessage() {
            when(ledger.findByPaymentReference("pi_4")).thenReturn(Optional.of(known));

            failedHandler().handle(event("payment_intent.payment_failed",
                    "{\"id\":\"pi_4\",\"last_payment_error\":{\"code\":\"card_declined\",\"message\":\"Your card was declined.\"}}"));

            verify(ledger).markFailed("pi_4", "Your card was declined.");
        }

        @Test
        void cancellationUsesCancellationReason() {
            when(ledger.findByPaymentReference("pi_5")).thenReturn(Optional.of(known));

            failedHandler().handle(event("payment_intent.canceled",
                    "{\"id\":\"pi_5\",\"cancellation_reason\":\"abandoned\"}"));

            verify(ledger).markFailed("pi_5", "canceled: abandoned");
        }
    }

    @Nested
    @DisplayName("refund events")
    class RefundEvents {

        private static final String HALF_REFUND =
                "{\"id\":\"ch_1\",\"payment_intent\":\"pi_1\",\"amount_refunded\":5000,\"refunded\":false}";

        @Test
        @DisplayName("Refund is recorded against the charge's payment intent")
        void refundIsRecorded() {
            stubRecorded(5_000, 4_240);
            when(balanceQuery.availableBalance(known.getSellerId(), CurrencyCode.USD)).thenReturn(4_240L);

            refundHandler().handle(event("charge.refunded", HALF_REFUND));

            verify(refundService).recordRefund("pi_1", "ch_1", 5_000);
            verify(ledger, never()).markFailed(any(), any());
            verifyNoInteractions(alertService);
        }

        @Test
        @DisplayName("Refund of money already paid out raises an alert")
        void refundBeyondUnpaidBalanceRaisesAlert() {
            stubRecorded(5_000, 4_240);
            when(balanceQuery.availableBalance(known.getSellerId(), CurrencyCode.USD)).thenReturn(-4_240L);

            refundHandler().handle(event("charge.refunded", HALF_REFUND));

            verify(alertService).raise(eq(AlertType.REFUND_EXCEEDS_BALANCE), eq(known.getId().toString()),
                    contains("4240 was already paid out"));
        }

        @Test
        void repeatedRefundReportChangesNothing() {
            when(refundService.recordRefund("pi_1", "ch_1", 5_000)).thenReturn(Optional.empty());

            refundHandler().handle(event("charge.refunded", HALF_REFUND));

            verifyNoInteractions(balanceQuery, alertService);
        }

        @Test
        void refundWithoutPaymentIntentIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> refundHandler().handle(event("charge.refunded",
                    "{\"id\":\"ch_2\",\"amount_refunded\":100}")));
            verifyNoInteractions(refundService);
        }

        private void stubRecorded(long refunded, long sellerShare) {
            when(refundService.recordRefund("pi_1", "ch_1", refunded)).thenReturn(Optional.of(new TransactionRefund(
                    known.getId(), "ch_1", refunded, sellerShare, CurrencyCode.USD, Instant.now())));
            when(ledger.findById(known.getId())).thenReturn(Optional.of(known));
        }

        private ChargeRefundedHandler refundHandler() {
            return new ChargeRefundedHandler(refundService, ledger, balanceQuery, alertService);
        }
    }

    @Nested
    @DisplayName("payout events")
    class PayoutEvents {

        @Test
        void paidPayoutIsCompleted() {
            new PayoutEventHandler(payoutCalculator).handle(event("payout.paid", "{\"id\":\"po_1\"}"));

            verify(payoutCalculator).markCompleted("po_1");
        }

        @Test
        void failedPayoutCarriesReason() {
            new PayoutEventHandler(payoutCalculator).handle(event("payout.failed",
                    "{\"id\":\"po_2\",\"failure_code\":\"account_closed\"}"));

            verify(payoutCalculator).markFailed("po_2", "account_closed");
        }
    }

    @Nested
    @DisplayName("subscription events")
    class SubscriptionEvents {

        @Test
        void updateIsMirrored() {
            UUID userId = UUID.randomUUID();

            new SubscriptionEventHandler(subscriptionService).handle(event("customer.subscription.updated",
                    "{\"id\":\"sub_1\",\"customer\":\"cus_1\",\"status\":\"past_due\",\"current_period_end\":1700086400,"
                            + "\"metadata\":{\"user_id\":\"" + userId + "\",\"tier\":\"pro\"}}"));

            ArgumentCaptor<SubscriptionUpdate> update = ArgumentCaptor.forClass(SubscriptionUpdate.class);
            verify(subscriptionService).apply(update.capture());
            assertEquals("sub_1", update.getValue().getProviderSubscriptionId());
            assertEquals("cus_1", update.getValue().getCustomerReference());
            assertEquals(userId, update.getValue().getUserId());
            assertEquals("pro", update.getValue().getTier());
            assertEquals(SubscriptionStatus.PAST_DUE, update.getValue().getStatus());
            assertEquals(Instant.ofEpochSecond(1_700_086_400L), update.getValue().getCurrentPeriodEnd());
            assertEquals(Instant.ofEpochSecond(1_700_000_000L), update.getValue().getEventAt());
        }

        @Test
        void deletionCancels() {
            new SubscriptionEventHandler(subscriptionService).handle(event("customer.subscription.deleted",
                    "{\"id\":\"sub_1\",\"status\":\"active\"}"));

            ArgumentCaptor<SubscriptionUpdate> update = ArgumentCaptor.forClass(SubscriptionUpdate.class);
            verify(subscriptionService).apply(update.capture());
            assertEquals(SubscriptionStatus.CANCELED, update.getValue().getStatus());
        }

        @Test
        void unknownStatusIsRejected() {
            assertThrows(IllegalArgumentException.class, () ->
                    new SubscriptionEventHandler(subscriptionService).handle(event("customer.subscription.updated",
                            "{\"id\":\"sub_1\",\"status\":\"paused_forever\"}")));
            verifyNoInteractions(subscriptionService);
        }
    }

    @Test
    void accountUpdateAppliesCapabilities() {
        when(accountDirectory.updateCapabilities("acct_1", true, false)).thenReturn(true);

        new AccountUpdatedHandler(accountDirectory).handle(event("account.updated",
                "{\"id\":\"acct_1\",\"charges_enabled\":true,\"payouts_enabled\":false}"));

        verify(accountDirectory).updateCapabilities("acct_1", true, false);
    }

    private PaymentSucceededHandler succeededHandler() {
        return new PaymentSucceededHandler(new PaymentReferenceResolver(ledger), ledger);
    }

    private PaymentFailedHandler failedHandler() {
        return new PaymentFailedHandler(new PaymentReferenceResolver(ledger), ledger);
    }

    private static ProviderEvent event(String type, String objectJson) {
        try {
            return ProviderEvent.fromJson(MAPPER.readTree(
                    "{\"id\":\"evt_1\",\"type\":\"" + type + "\",\"created\":1700000000,\"data\":{\"object\":"
                            + objectJson + "}}"));
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
