package com.flagship.settlement.transaction;

import com.flagship.settlement.catalog.CatalogItem;
import com.flagship.settlement.config.SettlementProperties;
import com.flagship.settlement.escrow.EscrowManager;
import com.flagship.settlement.exception.ConflictException;
import com.flagship.settlement.exception.NotFoundException;
import com.flagship.settlement.exception.SettlementErrorCode;
import com.flagship.settlement.exception.ValidationException;
import com.flagship.settlement.fee.FeeBreakdown;
import com.flagship.settlement.fee.FeeCalculator;
import com.flagship.settlement.observability.CorrelationContext;
import com.flagship.settlement.observability.SettlementMetrics;
import com.flagship.settlement.outbox.OutboxService;
import com.flagship.settlement.reconciliation.AlertType;
import com.flagship.settlement.reconciliation.ReconciliationAlertService;
import com.flagship.settlement.transaction.event.TransactionCreatedEvent;
import com.flagship.settlement.transaction.event.TransactionFailedEvent;
import com.flagship.settlement.transaction.event.TransactionSucceededEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The transaction state machine: PENDING to SUCCEEDED or FAILED.
 *
 * Creation writes the transaction, its escrow (when requested) and the
 * TransactionCreated event in one database transaction. Terminal transitions
 * are conditional updates keyed by payment reference:
 * <ul>
 *   <li>the first matching transition wins and publishes an event</li>
 *   <li>repeating the same transition is a no-op</li>
 *   <li>a contradicting transition is refused with CONFLICTING_STATE and
 *       recorded as a reconciliation alert</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionLedger {

    private static final String AGGREGATE_TYPE = "Transaction";

    private final TransactionRepository repository;
    private final EscrowManager escrowManager;
    private final OutboxService outboxService;
    private final ReconciliationAlertService alertService;
    private final SettlementProperties properties;
    private final SettlementMetrics metrics;

    /**
     * Creates a PENDING transaction for a buyer purchasing a catalog item.
     *
     * @throws ValidationException for self-purchase, unpublished or out-of-stock
     *         items, or fees that exceed the price
     */
    @Transactional
    public Transaction create(NewTransaction request) {
        CatalogItem item = request.getItem();

        if (request.getBuyerId().equals(item.getSellerId())) {
            throw new ValidationException(SettlementErrorCode.INVALID_OPERATION,
                "Buyer " + request.getBuyerId() + " cannot purchase their own item " + item.getId());
        }
        if (!item.isPublished()) {
            throw new ValidationException(SettlementErrorCode.INVALID_OPERATION,
                "Item " + item.getId() + " is not available for purchase");
        }
        if (!item.isInStock()) {
            throw new ValidationException(SettlementErrorCode.OUT_OF_STOCK,
                "Item " + item.getId() + " is out of stock");
        }

        FeeBreakdown fees = FeeCalculator.computeFees(
            item.getPrice(),
            item.getEarnerCategory(),
            properties.getFees().getProcessorRateBps(),
            properties.getFees().getProcessorFixedFee()
        );

        Transaction transaction = Transaction.pending(
            UUID.randomUUID(),
            request.getBuyerId(),
            item.getSellerId(),
            item.getId(),
            fees,
            item.getCurrency(),
            item.getEarnerCategory(),
            request.isUsesEscrow(),
            request.getAffiliateClickId()
        );

        Transaction saved = repository.saveAndFlush(
            TransactionEntity.fromDomain(transaction, request.getIdempotencyKey())).toDomain();

        if (saved.isUsesEscrow()) {
            escrowManager.openHold(saved);
        }

        outboxService.saveEvent(AGGREGATE_TYPE, saved.getId(),
            TransactionCreatedEvent.EVENT_TYPE, TransactionCreatedEvent.from(saved));

        log.info("Transaction {} created: gross={}, platformFee={}, processorFee={}, sellerNet={}, escrow={}",
            saved.getId(), saved.getGrossAmount(), saved.getPlatformFee(),
            saved.getProcessorFee(), saved.getSellerNet(), saved.isUsesEscrow());
        return saved;
    }

    @Transactional
    public Transaction markSucceeded(String paymentReference) {
        return transition(paymentReference, TransactionStatus.SUCCEEDED, null);
    }

    @Transactional
    public Transaction markFailed(String paymentReference, String reason) {
        return transition(paymentReference, TransactionStatus.FAILED, reason);
    }

    /**
     * Records the provider's payment reference. Binding the same reference
     * again is a no-op; binding a different one is a conflict.
     */
    @Transactional
    public Transaction bindPaymentReference(UUID transactionId, String paymentReference) {
        int updated = repository.bindPaymentReference(transactionId, paymentReference, Instant.now());
        Transaction current = loadById(transactionId);

        if (updated == 0 && !paymentReference.equals(current.getPaymentReference())) {
            throw new ConflictException(SettlementErrorCode.CONFLICTING_STATE, String.format(
                "Transaction %s is already bound to payment reference %s",
                transactionId, current.getPaymentReference()));
        }
        return current;
    }

    /**
     * Fails a transaction whose provider request never completed, so no
     * PENDING row is left behind. Does nothing if the transaction already
     * reached a terminal state.
     */
    @Transactional
    public Optional<Transaction> failUnconfirmed(UUID transactionId, String reason) {
        int updated = repository.transitionById(transactionId, TransactionStatus.PENDING,
            TransactionStatus.FAILED, reason, Instant.now());
        if (updated == 0) {
            log.warn("Transaction {} was not pending when failing unconfirmed checkout: {}", transactionId, reason);
            return Optional.empty();
        }

        Transaction failed = loadById(transactionId);
        outboxService.saveEvent(AGGREGATE_TYPE, transactionId,
            TransactionFailedEvent.EVENT_TYPE, TransactionFailedEvent.from(failed));
        metrics.recordTransition(TransactionStatus.FAILED.name(), "applied");
        log.info("Transaction {} failed before confirmation: {}", transactionId, reason);
        return Optional.of(failed);
    }

    @Transactional(readOnly = true)
    public Optional<Transaction> findById(UUID transactionId) {
        return repository.findById(transactionId).map(TransactionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Transaction> findByPaymentReference(String paymentReference) {
        return repository.findByPaymentReference(paymentReference).map(TransactionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Transaction> findByIdempotencyKey(String idempotencyKey) {
        return repository.findByIdempotencyKey(idempotencyKey).map(TransactionEntity::toDomain);
    }

    /**
     * PENDING transactions created before {@code cutoff}, oldest first.
     */
    @Transactional(readOnly = true)
    public List<Transaction> findPendingCreatedBefore(Instant cutoff) {
        return repository.findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(TransactionStatus.PENDING, cutoff)
            .stream()
            .map(TransactionEntity::toDomain)
            .toList();
    }

    private Transaction transition(String paymentReference, TransactionStatus target, String reason) {
        int updated = repository.transitionByReference(paymentReference, TransactionStatus.PENDING,
            target, reason, Instant.now());

        Transaction current = repository.findByPaymentReference(paymentReference)
            .map(TransactionEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of("Transaction with payment reference", paymentReference));

        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, current.getId().toString());
        try {
            if (updated == 1) {
                if (target == TransactionStatus.SUCCEEDED) {
                    outboxService.saveEvent(AGGREGATE_TYPE, current.getId(),
                        TransactionSucceededEvent.EVENT_TYPE, TransactionSucceededEvent.from(current));
                } else {
                    outboxService.saveEvent(AGGREGATE_TYPE, current.getId(),
                        TransactionFailedEvent.EVENT_TYPE, TransactionFailedEvent.from(current));
                }
                metrics.recordTransition(target.name(), "applied");
                log.info("Transaction {} moved PENDING -> {}", current.getId(), target);
                return current;
            }

            if (current.getStatus() == target) {
                metrics.recordTransition(target.name(), "noop");
                log.info("Transaction {} already {}, ignoring repeated transition", current.getId(), target);
                return current;
            }

            metrics.recordTransition(target.name(), "conflict");
            String detail = String.format("Requested %s for transaction %s but it is %s",
                target, current.getId(), current.getStatus());
            alertService.raise(AlertType.CONFLICTING_TRANSITION, paymentReference, detail);
            throw new ConflictException(SettlementErrorCode.CONFLICTING_STATE, detail);
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private Transaction loadById(UUID transactionId) {
        return repository.findById(transactionId)
            .map(TransactionEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of("Transaction", transactionId));
    }
}
