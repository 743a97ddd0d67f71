package com.flagship.settlement.reconciliation;

import com.flagship.settlement.observability.SettlementMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Records situations that need an operator: a provider side effect that was
 * not recorded locally, a contradictory state transition, a transaction stuck
 * in pending.
 *
 * Alerts are written in their own transaction so they survive the rollback of
 * the operation that raised them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationAlertService {

    private final ReconciliationAlertRepository repository;
    private final SettlementMetrics metrics;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public UUID raise(AlertType type, String reference, String detail) {
        ReconciliationAlertEntity saved = repository.save(ReconciliationAlertEntity.open(type, reference, detail));
        metrics.recordReconciliationAlert(type.name());
        log.error("RECONCILIATION ALERT {}: type={}, reference={}, detail={}",
                saved.getId(), type, reference, detail);
        return saved.getId();
    }

    /**
     * Raises an alert unless one of the same type already exists for the reference.
     *
     * @return true if a new alert was recorded
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean raiseOnce(AlertType type, String reference, String detail) {
        if (repository.existsByAlertTypeAndReference(type, reference)) {
            return false;
        }
        raise(type, reference, detail);
        return true;
    }

    @Transactional(readOnly = true)
    public List<ReconciliationAlert> findOpenAlerts() {
        return repository.findByResolvedFalseOrderByCreatedAtDesc()
                .stream()
                .map(ReconciliationAlertEntity::toDomain)
                .toList();
    }
}
