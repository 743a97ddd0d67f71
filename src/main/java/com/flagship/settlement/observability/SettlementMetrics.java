package com.flagship.settlement.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Counters and timers for settlement operations.
 *
 * Meters are looked up through {@code registry.counter(name, tags...)} so tag
 * combinations are created on first use. Free-form values pass through
 * {@link #sanitizeTag} to keep cardinality bounded.
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCheckout(String outcome) {
        registry.counter("settlement.checkout", "outcome", sanitizeTag(outcome)).increment();
    }

    /**
     * @param outcome applied, noop or conflict
     */
    public void recordTransition(String targetStatus, String outcome) {
        registry.counter("settlement.transition",
                "target", sanitizeTag(targetStatus),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordEscrowAction(String action, String outcome) {
        registry.counter("settlement.escrow",
                "action", sanitizeTag(action),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordRefund(String outcome) {
        registry.counter("settlement.refund", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordCommission(String outcome) {
        registry.counter("settlement.commission", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordPayout(String outcome) {
        registry.counter("settlement.payout", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordWebhook(String eventType, String outcome) {
        registry.counter("settlement.webhook",
                "event_type", sanitizeTag(eventType),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    /**
     * A best-effort write that failed after the primary record was committed.
     */
    public void recordSecondaryEffectFailure(String effect) {
        registry.counter("settlement.secondary_effect.failed", "effect", sanitizeTag(effect)).increment();
    }

    public void recordReconciliationAlert(String alertType) {
        registry.counter("settlement.reconciliation.alerts", "type", sanitizeTag(alertType)).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("settlement.latency", "operation", sanitizeTag(operation))
                .record(Duration.ofMillis(durationMs));
    }

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_.]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
