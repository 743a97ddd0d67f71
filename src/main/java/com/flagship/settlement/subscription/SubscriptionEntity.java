package com.flagship.settlement.subscription;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "provider_subscriptions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SubscriptionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "provider_subscription_id", nullable = false, unique = true, updatable = false)
    private String providerSubscriptionId;

    @Column(name = "customer_reference")
    private String customerReference;

    @Column(name = "user_id")
    private UUID userId;

    @Column(length = 50)
    private String tier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SubscriptionStatus status;

    @Column(name = "current_period_end")
    private Instant currentPeriodEnd;

    @Column(name = "last_event_at", nullable = false)
    private Instant lastEventAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static SubscriptionEntity create(SubscriptionUpdate update) {
        return new SubscriptionEntity(
            UUID.randomUUID(),
            update.getProviderSubscriptionId(),
            update.getCustomerReference(),
            update.getUserId(),
            update.getTier(),
            update.getStatus(),
            update.getCurrentPeriodEnd(),
            update.getEventAt(),
            null,
            null
        );
    }

    /**
     * Overwrites the tracked state. Fields the event does not carry keep
     * their previous value.
     */
    void apply(SubscriptionUpdate update) {
        if (update.getCustomerReference() != null) {
            this.customerReference = update.getCustomerReference();
        }
        if (update.getUserId() != null) {
            this.userId = update.getUserId();
        }
        if (update.getTier() != null) {
            this.tier = update.getTier();
        }
        this.status = update.getStatus();
        this.currentPeriodEnd = update.getCurrentPeriodEnd();
        this.lastEventAt = update.getEventAt();
    }

    public ProviderSubscription toDomain() {
        return new ProviderSubscription(
            id,
            providerSubscriptionId,
            customerReference,
            userId,
            tier,
            status,
            currentPeriodEnd,
            lastEventAt
        );
    }
}
