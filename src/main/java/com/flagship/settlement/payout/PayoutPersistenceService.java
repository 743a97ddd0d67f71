package com.flagship.settlement.payout;

import com.flagship.settlement.outbox.OutboxService;
import com.flagship.settlement.payout.event.PayoutRequestedEvent;
import com.flagship.settlement.payout.event.PayoutSettledEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Payout rows and their events.
 *
 * Records written after a provider call run in their own transaction so the
 * outcome of the external request is stored even when the caller rolls back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutPersistenceService {

    private static final String AGGREGATE_TYPE = "Payout";

    private final PayoutRepository repository;
    private final OutboxService outboxService;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Payout recordAccepted(Payout payout) {
        Payout saved = repository.saveAndFlush(PayoutEntity.fromDomain(payout)).toDomain();
        outboxService.saveEvent(AGGREGATE_TYPE, saved.getId(),
            PayoutRequestedEvent.EVENT_TYPE, PayoutRequestedEvent.from(saved));
        log.debug("Saved payout {} with external id {}", saved.getId(), saved.getExternalPayoutId());
        return saved;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Payout recordRejected(Payout payout) {
        return repository.saveAndFlush(PayoutEntity.fromDomain(payout)).toDomain();
    }

    /**
     * Applies a provider outcome to a PENDING payout.
     *
     * @return the payout if it moved, empty if it was unknown or already settled
     */
    @Transactional
    public Optional<Payout> settle(String externalPayoutId, PayoutStatus target, String reason) {
        if (repository.settle(externalPayoutId, target, reason, Instant.now()) == 0) {
            return Optional.empty();
        }
        Payout settled = repository.findByExternalPayoutId(externalPayoutId)
            .map(PayoutEntity::toDomain)
            .orElseThrow(() -> new IllegalStateException("Payout " + externalPayoutId + " vanished after update"));
        outboxService.saveEvent(AGGREGATE_TYPE, settled.getId(),
            PayoutSettledEvent.EVENT_TYPE, PayoutSettledEvent.from(settled));
        return Optional.of(settled);
    }

    @Transactional(readOnly = true)
    public Optional<Payout> findByExternalPayoutId(String externalPayoutId) {
        return repository.findByExternalPayoutId(externalPayoutId).map(PayoutEntity::toDomain);
    }
}
