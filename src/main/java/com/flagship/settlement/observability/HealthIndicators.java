package com.flagship.settlement.observability;

import com.flagship.settlement.outbox.OutboxEventRepository;
import com.flagship.settlement.reconciliation.ReconciliationAlertRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Readiness checks specific to settlement.
 */
public class HealthIndicators {

    /**
     * Down when the outbox backlog suggests the publisher has stalled.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Reports unresolved reconciliation alerts. The service keeps serving
     * traffic; the status only draws operator attention.
     */
    @Component("reconciliationHealth")
    public static class ReconciliationHealthIndicator implements HealthIndicator {

        private final ReconciliationAlertRepository alertRepository;

        public ReconciliationHealthIndicator(ReconciliationAlertRepository alertRepository) {
            this.alertRepository = alertRepository;
        }

        @Override
        public Health health() {
            try {
                long open = alertRepository.countByResolvedFalse();
                Health.Builder builder = open == 0 ? Health.up() : Health.status("ATTENTION");
                return builder.withDetail("openAlerts", open).build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Redis only backs the checkout idempotency fast path, so an outage is
     * reported as degraded rather than down.
     */
    @Component("idempotencyCacheHealth")
    public static class IdempotencyCacheHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public IdempotencyCacheHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return degraded("No connection factory configured");
                }
                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    return "PONG".equals(result)
                            ? Health.up().withDetail("response", result).build()
                            : degraded("Unexpected ping response: " + result);
                }
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "Checkout idempotency falls back to the database")
                    .build();
        }
    }

    /**
     * Checks that the outbox producer holds live broker connections.
     */
    @Component("settlementKafkaHealth")
    public static class SettlementKafkaHealthIndicator implements HealthIndicator {

        private static final String CONNECTION_COUNT = "connection-count";

        private final KafkaTemplate<String, String> kafkaTemplate;
        private final String settlementTopic;

        public SettlementKafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate,
                                              @Value("${kafka.topic.settlement:settlement-events}") String settlementTopic) {
            this.kafkaTemplate = kafkaTemplate;
            this.settlementTopic = settlementTopic;
        }

        @Override
        public Health health() {
            try {
                double connections = kafkaTemplate.metrics().entrySet().stream()
                        .filter(entry -> CONNECTION_COUNT.equals(entry.getKey().name()))
                        .mapToDouble(entry -> ((Number) entry.getValue().metricValue()).doubleValue())
                        .sum();

                Health.Builder builder = connections > 0 ? Health.up() : Health.down();
                return builder
                        .withDetail("topic", settlementTopic)
                        .withDetail("connections", (long) connections)
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("topic", settlementTopic)
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
