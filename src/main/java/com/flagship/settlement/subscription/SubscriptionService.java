package com.flagship.settlement.subscription;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Keeps provider subscription records in step with webhook events.
 *
 * Events may arrive out of order. An event created before the last applied
 * one is ignored, so the stored row always reflects the newest state seen.
 * Applying the same event twice leaves the same row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionService {

    private final SubscriptionRepository repository;

    /**
     * @return true if the update was written, false if it was older than the stored state
     */
    @Transactional
    public boolean apply(SubscriptionUpdate update) {
        Optional<SubscriptionEntity> existing =
            repository.findByProviderSubscriptionId(update.getProviderSubscriptionId());

        if (existing.isEmpty()) {
            repository.save(SubscriptionEntity.create(update));
            log.info("Subscription {} recorded as {}", update.getProviderSubscriptionId(), update.getStatus());
            return true;
        }

        SubscriptionEntity entity = existing.get();
        if (update.getEventAt().isBefore(entity.getLastEventAt())) {
            log.info("Ignoring stale update for subscription {}: event at {} is older than {}",
                update.getProviderSubscriptionId(), update.getEventAt(), entity.getLastEventAt());
            return false;
        }

        SubscriptionStatus previous = entity.getStatus();
        entity.apply(update);
        log.info("Subscription {} moved {} -> {}", update.getProviderSubscriptionId(), previous, update.getStatus());
        return true;
    }

    @Transactional(readOnly = true)
    public Optional<ProviderSubscription> findByProviderSubscriptionId(String providerSubscriptionId) {
        return repository.findByProviderSubscriptionId(providerSubscriptionId).map(SubscriptionEntity::toDomain);
    }
}
