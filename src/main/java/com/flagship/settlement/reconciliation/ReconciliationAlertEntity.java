package com.flagship.settlement.reconciliation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "reconciliation_alerts",
    indexes = {
        @Index(name = "idx_reconciliation_alerts_open", columnList = "resolved, created_at"),
        @Index(name = "idx_reconciliation_alerts_reference", columnList = "alert_type, reference")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReconciliationAlertEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "alert_type", nullable = false, updatable = false, length = 50)
    private AlertType alertType;

    @Column(nullable = false, updatable = false)
    private String reference;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String detail;

    @Column(nullable = false)
    private boolean resolved;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static ReconciliationAlertEntity open(AlertType type, String reference, String detail) {
        return new ReconciliationAlertEntity(UUID.randomUUID(), type, reference, detail, false, null);
    }

    public ReconciliationAlert toDomain() {
        return new ReconciliationAlert(id, alertType, reference, detail, resolved, createdAt);
    }
}
