package com.flagship.settlement.transaction;

import com.flagship.settlement.catalog.CatalogItem;
import com.flagship.settlement.config.SettlementProperties;
import com.flagship.settlement.escrow.EscrowManager;
import com.flagship.settlement.exception.ConflictException;
import com.flagship.settlement.exception.NotFoundException;
import com.flagship.settlement.exception.SettlementErrorCode;
import com.flagship.settlement.exception.ValidationException;
import com.flagship.settlement.fee.EarnerCategory;
import com.flagship.settlement.observability.SettlementMetrics;
import com.flagship.settlement.outbox.OutboxService;
import com.flagship.settlement.reconciliation.AlertType;
import com.flagship.settlement.reconciliation.ReconciliationAlertService;
import com.flagship.settlement.transaction.event.TransactionFailedEvent;
import com.flagship.settlement.transaction.event.TransactionSucceededEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TransactionLedgerTest {

    private static final String REFERENCE = "pi_123";

    @Mock
    private TransactionRepository repository;
    @Mock
    private EscrowManager escrowManager;
    @Mock
    private OutboxService outboxService;
    @Mock
    private ReconciliationAlertService alertService;

    private SimpleMeterRegistry registry;
    private TransactionLedger ledger;

    private final UUID buyerId = UUID.randomUUID();
    private final UUID sellerId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        ledger = new TransactionLedger(repository, escrowManager, outboxService, alertService,
                new SettlementProperties(), new SettlementMetrics(registry));
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("Vendor item of 10000 is stored PENDING with a 1200 / 320 / 8480 split")
        void createsPendingTransaction() {
            when(repository.saveAndFlush(any(TransactionEntity.class))).thenAnswer(inv -> inv.getArgument(0));

            Transaction created = ledger.create(new NewTransaction(buyerId, item(10_000, 5, true), false,
                    "key-1", null));

            assertEquals(TransactionStatus.PENDING, created.getStatus());
            assertEquals(1_200, created.getPlatformFee());
            assertEquals(320, created.getProcessorFee());
            assertEquals(8_480, created.getSellerNet());
            assertEquals(sellerId, created.getSellerId());
            verify(escrowManager, never()).openHold(any());
            verify(outboxService).saveEvent(eq("Transaction"), eq(created.getId()),
                    eq("TransactionCreated"), any());
        }

        @Test
        void opensEscrowHoldWhenRequested() {
            when(repository.saveAndFlush(any(TransactionEntity.class))).thenAnswer(inv -> inv.getArgument(0));

            Transaction created = ledger.create(new NewTransaction(buyerId, item(10_000, null, true), true,
                    "key-2", null));

            assertTrue(created.isUsesEscrow());
            verify(escrowManager).openHold(created);
        }

        @Test
        void rejectsSelfPurchase() {
            ValidationException e = assertThrows(ValidationException.class, () ->
                    ledger.create(new NewTransaction(sellerId, item(10_000, 5, true), false, "key-3", null)));

            assertEquals(SettlementErrorCode.INVALID_OPERATION, e.getCode());
            verifyNoInteractions(repository, outboxService);
        }

        @Test
        void rejectsOutOfStockItem() {
            ValidationException e = assertThrows(ValidationException.class, () ->
                    ledger.create(new NewTransaction(buyerId, item(10_000, 0, true), false, "key-4", null)));

            assertEquals(SettlementErrorCode.OUT_OF_STOCK, e.getCode());
            verifyNoInteractions(repository);
        }

        @Test
        void rejectsUnpublishedItem() {
            ValidationException e = assertThrows(ValidationException.class, () ->
                    ledger.create(new NewTransaction(buyerId, item(10_000, 5, false), false, "key-5", null)));

            assertEquals(SettlementErrorCode.INVALID_OPERATION, e.getCode());
        }

        @Test
        void rejectsPriceBelowFees() {
            ValidationException e = assertThrows(ValidationException.class, () ->
                    ledger.create(new NewTransaction(buyerId, item(30, 5, true), false, "key-6", null)));

            assertEquals(SettlementErrorCode.INVALID_FEE_CONFIGURATION, e.getCode());
            verifyNoInteractions(repository);
        }
    }

    @Nested
    @DisplayName("terminal transitions")
    class Transitions {

        @Test
        void firstSuccessIsAppliedAndPublished() {
            Transaction succeeded = stored(TransactionStatus.SUCCEEDED, null);
            when(repository.transitionByReference(eq(REFERENCE), eq(TransactionStatus.PENDING),
                    eq(TransactionStatus.SUCCEEDED), isNull(), any(Instant.class))).thenReturn(1);
            when(repository.findByPaymentReference(REFERENCE)).thenReturn(Optional.of(entity(succeeded)));

            Transaction result = ledger.markSucceeded(REFERENCE);

            assertEquals(TransactionStatus.SUCCEEDED, result.getStatus());
            verify(outboxService).saveEvent(eq("Transaction"), eq(succeeded.getId()),
                    eq(TransactionSucceededEvent.EVENT_TYPE), any(TransactionSucceededEvent.class));
            assertEquals(1.0, registry.counter("settlement.transition",
                    "target", "SUCCEEDED", "outcome", "applied").count());
        }

        @Test
        void repeatedSuccessIsNoop() {
            Transaction succeeded = stored(TransactionStatus.SUCCEEDED, null);
            when(repository.transitionByReference(any(), any(), any(), any(), any())).thenReturn(0);
            when(repository.findByPaymentReference(REFERENCE)).thenReturn(Optional.of(entity(succeeded)));

            Transaction result = ledger.markSucceeded(REFERENCE);

            assertEquals(TransactionStatus.SUCCEEDED, result.getStatus());
            verifyNoInteractions(outboxService, alertService);
            assertEquals(1.0, registry.counter("settlement.transition",
                    "target", "SUCCEEDED", "outcome", "noop").count());
        }

        @Test
        void failureIsPublishedWithReason() {
            Transaction failed = stored(TransactionStatus.FAILED, "card_declined");
            when(repository.transitionByReference(eq(REFERENCE), eq(TransactionStatus.PENDING),
                    eq(TransactionStatus.FAILED), eq("card_declined"), any(Instant.class))).thenReturn(1);
            when(repository.findByPaymentReference(REFERENCE)).thenReturn(Optional.of(entity(failed)));

            Transaction result = ledger.markFailed(REFERENCE, "card_declined");

            assertEquals("card_declined", result.getFailureReason());
            verify(outboxService).saveEvent(eq("Transaction"), eq(failed.getId()),
                    eq(TransactionFailedEvent.EVENT_TYPE), any(TransactionFailedEvent.class));
        }

        @Test
        @DisplayName("Failure after success is refused and flagged")
        void contradictingTransitionIsConflict() {
            Transaction succeeded = stored(TransactionStatus.SUCCEEDED, null);
            when(repository.transitionByReference(any(), any(), any(), any(), any())).thenReturn(0);
            when(repository.findByPaymentReference(REFERENCE)).thenReturn(Optional.of(entity(succeeded)));

            ConflictException e = assertThrows(ConflictException.class,
                    () -> ledger.markFailed(REFERENCE, "late_failure"));

            assertEquals(SettlementErrorCode.CONFLICTING_STATE, e.getCode());
            verify(alertService).raise(eq(AlertType.CONFLICTING_TRANSITION), eq(REFERENCE), anyString());
            verifyNoInteractions(outboxService);
        }

        @Test
        void unknownReferenceIsNotFound() {
            when(repository.transitionByReference(any(), any(), any(), any(), any())).thenReturn(0);
            when(repository.findByPaymentReference("pi_unknown")).thenReturn(Optional.empty());

            assertThrows(NotFoundException.class, () -> ledger.markSucceeded("pi_unknown"));
        }
    }

    @Nested
    @DisplayName("payment reference binding")
    class Binding {

        @Test
        void bindingSameReferenceTwiceIsNoop() {
            Transaction bound = stored(TransactionStatus.PENDING, null);
            when(repository.bindPaymentReference(eq(bound.getId()), eq(REFERENCE), any())).thenReturn(0);
            when(repository.findById(bound.getId())).thenReturn(Optional.of(entity(bound)));

            assertEquals(REFERENCE, ledger.bindPaymentReference(bound.getId(), REFERENCE).getPaymentReference());
        }

        @Test
        void bindingDifferentReferenceIsConflict() {
            Transaction bound = stored(TransactionStatus.PENDING, null);
            when(repository.bindPaymentReference(eq(bound.getId()), eq("pi_other"), any())).thenReturn(0);
            when(repository.findById(bound.getId())).thenReturn(Optional.of(entity(bound)));

            ConflictException e = assertThrows(ConflictException.class,
                    () -> ledger.bindPaymentReference(bound.getId(), "pi_other"));
            assertEquals(SettlementErrorCode.CONFLICTING_STATE, e.getCode());
        }
    }

    @Test
    void failUnconfirmedSkipsTransactionsNoLongerPending() {
        UUID id = UUID.randomUUID();
        when(repository.transitionById(eq(id), eq(TransactionStatus.PENDING), eq(TransactionStatus.FAILED),
                eq("provider_timeout"), any())).thenReturn(0);

        assertTrue(ledger.failUnconfirmed(id, "provider_timeout").isEmpty());
        verifyNoInteractions(outboxService);
    }

    @Test
    void failUnconfirmedPublishesFailure() {
        Transaction failed = stored(TransactionStatus.FAILED, "provider_error");
        when(repository.transitionById(eq(failed.getId()), eq(TransactionStatus.PENDING),
                eq(TransactionStatus.FAILED), eq("provider_error"), any())).thenReturn(1);
        when(repository.findById(failed.getId())).thenReturn(Optional.of(entity(failed)));

        Optional<Transaction> result = ledger.failUnconfirmed(failed.getId(), "provider_error");

        assertTrue(result.isPresent());
        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(outboxService).saveEvent(eq("Transaction"), eq(failed.getId()),
                eq(TransactionFailedEvent.EVENT_TYPE), payload.capture());
        assertInstanceOf(TransactionFailedEvent.class, payload.getValue());
    }

    @Test
    void findsStalePendingTransactions() {
        Transaction pending = stored(TransactionStatus.PENDING, null);
        Instant cutoff = Instant.now();
        when(repository.findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(TransactionStatus.PENDING, cutoff))
                .thenReturn(List.of(entity(pending)));

        List<Transaction> stale = ledger.findPendingCreatedBefore(cutoff);

        assertEquals(1, stale.size());
        assertEquals(pending.getId(), stale.get(0).getId());
    }

    private CatalogItem item(long price, Integer inventory, boolean published) {
        return new CatalogItem(UUID.randomUUID(), sellerId, "Desk lamp", price, CurrencyCode.USD,
                EarnerCategory.VENDOR, inventory, published);
    }

    private Transaction stored(TransactionStatus status, String failureReason) {
        Instant now = Instant.now();
        return new Transaction(UUID.randomUUID(), buyerId, sellerId, UUID.randomUUID(), 10_000, CurrencyCode.USD,
                1_200, 320, 8_480, EarnerCategory.VENDOR, status, false, REFERENCE, null, failureReason, now, now);
    }

    private TransactionEntity entity(Transaction transaction) {
        return TransactionEntity.fromDomain(transaction, "key-" + transaction.getId());
    }
}
