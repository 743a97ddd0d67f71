package com.flagship.settlement.reconciliation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ReconciliationAlertRepository extends JpaRepository<ReconciliationAlertEntity, UUID> {

    long countByResolvedFalse();

    boolean existsByAlertTypeAndReference(AlertType alertType, String reference);

    List<ReconciliationAlertEntity> findByResolvedFalseOrderByCreatedAtDesc();
}
