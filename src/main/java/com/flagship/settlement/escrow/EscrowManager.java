package com.flagship.settlement.escrow;

import com.flagship.settlement.config.SettlementProperties;
import com.flagship.settlement.escrow.event.EscrowDisputedEvent;
import com.flagship.settlement.escrow.event.EscrowReleasedEvent;
import com.flagship.settlement.exception.ConflictException;
import com.flagship.settlement.exception.NotFoundException;
import com.flagship.settlement.exception.SettlementErrorCode;
import com.flagship.settlement.exception.ValidationException;
import com.flagship.settlement.observability.SettlementMetrics;
import com.flagship.settlement.outbox.OutboxService;
import com.flagship.settlement.transaction.Transaction;
import com.flagship.settlement.transaction.TransactionEntity;
import com.flagship.settlement.transaction.TransactionRepository;
import com.flagship.settlement.transaction.TransactionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Escrow hold, dispute and release.
 *
 * Release rules:
 * - the actor must be the buyer, the seller or a configured administrator
 * - the parent transaction must have SUCCEEDED
 * - a HELD escrow can be released by any permitted actor
 * - a DISPUTED escrow can only be released by an administrator
 *
 * Every change is a conditional update on the expected status, so two
 * concurrent releases produce exactly one RELEASED row and one InvalidState.
 * A successful release also publishes {@link EscrowReleasedEvent} in-process;
 * {@link EscrowTransferService} moves the funds once the release commits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowManager {

    private static final String AGGREGATE_TYPE = "Escrow";

    private final EscrowRepository escrowRepository;
    private final TransactionRepository transactionRepository;
    private final OutboxService outboxService;
    private final SettlementProperties properties;
    private final SettlementMetrics metrics;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Creates the HELD escrow for a new escrow-backed transaction. Must run in
     * the transaction that inserts the parent row so neither exists without the other.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Escrow openHold(Transaction transaction) {
        Escrow escrow = Escrow.holdFor(transaction);
        EscrowEntity saved = escrowRepository.save(EscrowEntity.fromDomain(escrow));
        log.info("Escrow {} holding {} for transaction {}",
                saved.getId(), saved.getHeldAmount(), transaction.getId());
        return saved.toDomain();
    }

    @Transactional
    public Escrow release(UUID escrowId, UUID actorId) {
        Escrow escrow = load(escrowId);
        boolean admin = isAdmin(actorId);
        requirePermitted(escrow, actorId, admin);

        TransactionEntity parent = transactionRepository.findById(escrow.getTransactionId())
            .orElseThrow(() -> NotFoundException.of("Transaction", escrow.getTransactionId()));

        if (parent.getStatus() != TransactionStatus.SUCCEEDED) {
            metrics.recordEscrowAction("release", "invalid_state");
            throw new ConflictException(SettlementErrorCode.INVALID_STATE, String.format(
                "Escrow %s cannot be released while transaction %s is %s",
                escrowId, parent.getId(), parent.getStatus()));
        }

        EscrowStatus expected = escrow.getStatus();
        if (expected == EscrowStatus.RELEASED
                || (expected == EscrowStatus.DISPUTED && !admin)) {
            metrics.recordEscrowAction("release", "invalid_state");
            throw new ConflictException(SettlementErrorCode.INVALID_STATE, String.format(
                "Escrow %s is %s and cannot be released by %s", escrowId, expected, actorId));
        }

        int updated = escrowRepository.release(escrowId, expected, actorId, Instant.now());
        if (updated == 0) {
            metrics.recordEscrowAction("release", "invalid_state");
            throw new ConflictException(SettlementErrorCode.INVALID_STATE,
                "Escrow " + escrowId + " changed state concurrently");
        }

        Escrow released = load(escrowId);
        EscrowReleasedEvent releasedEvent = EscrowReleasedEvent.from(released);
        outboxService.saveEvent(AGGREGATE_TYPE, escrowId, EscrowReleasedEvent.EVENT_TYPE, releasedEvent);
        eventPublisher.publishEvent(releasedEvent);
        metrics.recordEscrowAction("release", "applied");

        log.info("Escrow {} released by {} (from {}), amount={}",
                escrowId, actorId, expected, released.getHeldAmount());
        return released;
    }

    @Transactional
    public Escrow openDispute(UUID escrowId, UUID actorId) {
        Escrow escrow = load(escrowId);
        requirePermitted(escrow, actorId, isAdmin(actorId));

        if (escrow.getStatus() != EscrowStatus.HELD) {
            metrics.recordEscrowAction("dispute", "invalid_state");
            throw new ConflictException(SettlementErrorCode.INVALID_STATE, String.format(
                "Escrow %s is %s; only HELD escrows can be disputed", escrowId, escrow.getStatus()));
        }

        if (escrowRepository.openDispute(escrowId, actorId, Instant.now()) == 0) {
            metrics.recordEscrowAction("dispute", "invalid_state");
            throw new ConflictException(SettlementErrorCode.INVALID_STATE,
                "Escrow " + escrowId + " changed state concurrently");
        }

        Escrow disputed = load(escrowId);
        outboxService.saveEvent(AGGREGATE_TYPE, escrowId, EscrowDisputedEvent.EVENT_TYPE,
                EscrowDisputedEvent.from(disputed));
        metrics.recordEscrowAction("dispute", "applied");

        log.info("Escrow {} disputed by {}", escrowId, actorId);
        return disputed;
    }

    /**
     * Stores the provider transfer for a released escrow. Runs in its own
     * transaction because it is called after the release has committed.
     *
     * @return false if a transfer was already recorded
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean recordTransfer(UUID escrowId, String transferReference) {
        return escrowRepository.recordTransfer(escrowId, transferReference, Instant.now()) == 1;
    }

    @Transactional(readOnly = true)
    public Optional<Escrow> findById(UUID escrowId) {
        return escrowRepository.findById(escrowId).map(EscrowEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Escrow> findByTransactionId(UUID transactionId) {
        return escrowRepository.findByTransactionId(transactionId).map(EscrowEntity::toDomain);
    }

    /**
     * Only the parties and administrators may see an escrow.
     */
    @Transactional(readOnly = true)
    public Escrow getVisibleTo(UUID escrowId, UUID viewerId) {
        Escrow escrow = load(escrowId);
        if (!escrow.isParty(viewerId) && !isAdmin(viewerId)) {
            // Same answer as a missing escrow
            throw NotFoundException.of("Escrow", escrowId);
        }
        return escrow;
    }

    private Escrow load(UUID escrowId) {
        return escrowRepository.findById(escrowId)
            .map(EscrowEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of("Escrow", escrowId));
    }

    private boolean isAdmin(UUID actorId) {
        return properties.getEscrow().getAdminIds().contains(actorId);
    }

    private void requirePermitted(Escrow escrow, UUID actorId, boolean admin) {
        if (!admin && !escrow.isParty(actorId)) {
            metrics.recordEscrowAction("access", "denied");
            throw new ValidationException(SettlementErrorCode.INVALID_OPERATION,
                "Actor " + actorId + " is not a party to escrow " + escrow.getId());
        }
    }
}
