package com.flagship.settlement.transaction;

import com.flagship.settlement.exception.ConflictException;
import com.flagship.settlement.exception.NotFoundException;
import com.flagship.settlement.exception.SettlementErrorCode;
import com.flagship.settlement.exception.ValidationException;
import com.flagship.settlement.observability.SettlementMetrics;
import com.flagship.settlement.outbox.OutboxService;
import com.flagship.settlement.transaction.event.TransactionRefundedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Records provider refunds against succeeded transactions.
 *
 * The transaction keeps its SUCCEEDED status; the refund lives in its own row
 * and is subtracted from the seller's withdrawable balance. The provider
 * reports the cumulative refunded amount, so recording only ever raises it:
 * repeated and out-of-order reports are no-ops.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionRefundService {

    private static final String AGGREGATE_TYPE = "Transaction";

    private final TransactionRepository transactionRepository;
    private final TransactionRefundRepository refundRepository;
    private final OutboxService outboxService;
    private final SettlementMetrics metrics;

    /**
     * @return the refund when it raised the recorded amount, empty for a repeated or stale report
     * @throws NotFoundException when no transaction has the payment reference
     * @throws ConflictException INVALID_STATE when the transaction has not succeeded
     * @throws ValidationException INVALID_OPERATION when the amount is not within the gross
     */
    @Transactional
    public Optional<TransactionRefund> recordRefund(String paymentReference, String chargeReference,
                                                    long refundedAmount) {
        Transaction transaction = transactionRepository.findByPaymentReference(paymentReference)
            .map(TransactionEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of("Transaction with payment reference", paymentReference));

        if (!transaction.isSucceeded()) {
            metrics.recordRefund("invalid_state");
            throw new ConflictException(SettlementErrorCode.INVALID_STATE, String.format(
                "Refund reported for transaction %s which is %s", transaction.getId(), transaction.getStatus()));
        }

        TransactionRefund refund;
        try {
            refund = TransactionRefund.of(transaction, chargeReference, refundedAmount);
        } catch (IllegalArgumentException e) {
            metrics.recordRefund("invalid_amount");
            throw new ValidationException(SettlementErrorCode.INVALID_OPERATION, e.getMessage());
        }

        boolean applied;
        if (refundRepository.existsById(transaction.getId())) {
            applied = refundRepository.raise(transaction.getId(), refund.getRefundedAmount(),
                refund.getSellerRefundAmount(), chargeReference, Instant.now()) == 1;
        } else {
            refundRepository.saveAndFlush(TransactionRefundEntity.fromDomain(refund));
            applied = true;
        }

        if (!applied) {
            metrics.recordRefund("noop");
            log.info("Transaction {} already has refunds of at least {}, ignoring report",
                transaction.getId(), refundedAmount);
            return Optional.empty();
        }

        outboxService.saveEvent(AGGREGATE_TYPE, transaction.getId(),
            TransactionRefundedEvent.EVENT_TYPE, TransactionRefundedEvent.from(transaction, refund));
        metrics.recordRefund("applied");
        log.info("Transaction {} refunded {} in total, seller share {}",
            transaction.getId(), refund.getRefundedAmount(), refund.getSellerRefundAmount());
        return Optional.of(refund);
    }

    /**
     * Seller share of all refunds recorded for the transaction, 0 when none.
     */
    @Transactional(readOnly = true)
    public long sellerRefundedAmount(UUID transactionId) {
        return refundRepository.findById(transactionId)
            .map(TransactionRefundEntity::getSellerRefundAmount)
            .orElse(0L);
    }
}
