package com.flagship.settlement.transaction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps checkout idempotency keys to transaction ids.
 *
 * Redis is a cache in front of the unique idempotency_key column: lookups try
 * Redis first and fall back to the database, and a Redis outage only costs
 * latency.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "checkout-idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final TransactionRepository transactionRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(TransactionRepository transactionRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.transactionRepository = transactionRepository;
        this.redisTemplate = redisTemplate;
    }

    public Optional<UUID> findTransactionId(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> stored = transactionRepository.findByIdempotencyKey(idempotencyKey)
                .map(TransactionEntity::getId);
        stored.ifPresent(id -> cache(idempotencyKey, id));
        return stored;
    }

    /**
     * Caches a key after its transaction has been committed. The database row
     * remains the source of truth.
     */
    public void remember(String idempotencyKey, UUID transactionId) {
        requireKey(idempotencyKey);
        if (transactionId == null) {
            throw new IllegalArgumentException("Transaction ID cannot be null");
        }
        cache(idempotencyKey, transactionId);
    }

    private void cache(String idempotencyKey, UUID transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue()
                    .set(REDIS_KEY_PREFIX + idempotencyKey, transactionId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
