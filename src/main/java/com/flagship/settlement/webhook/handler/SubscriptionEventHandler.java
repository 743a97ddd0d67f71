package com.flagship.settlement.webhook.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.settlement.subscription.SubscriptionService;
import com.flagship.settlement.subscription.SubscriptionStatus;
import com.flagship.settlement.subscription.SubscriptionUpdate;
import com.flagship.settlement.webhook.ProviderEvent;
import com.flagship.settlement.webhook.WebhookEventHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class SubscriptionEventHandler implements WebhookEventHandler {

    static final String SUBSCRIPTION_DELETED = "customer.subscription.deleted";

    private final SubscriptionService subscriptionService;

    @Override
    public Set<String> supportedEventTypes() {
        return Set.of("customer.subscription.created", "customer.subscription.updated", SUBSCRIPTION_DELETED);
    }

    @Override
    public void handle(ProviderEvent event) {
        String subscriptionId = event.getObjectId();
        if (subscriptionId == null) {
            throw new IllegalArgumentException("Subscription event " + event.getId() + " has no subscription id");
        }

        SubscriptionStatus status = SUBSCRIPTION_DELETED.equals(event.getType())
            ? SubscriptionStatus.CANCELED
            : SubscriptionStatus.fromProviderCode(event.field("status"));

        String userId = event.metadata("user_id");
        JsonNode periodEnd = event.getObject().get("current_period_end");

        subscriptionService.apply(new SubscriptionUpdate(
            subscriptionId,
            event.field("customer"),
            userId != null ? UUID.fromString(userId) : null,
            event.metadata("tier"),
            status,
            periodEnd != null && periodEnd.canConvertToLong() ? Instant.ofEpochSecond(periodEnd.asLong()) : null,
            event.getCreated()
        ));
    }
}
