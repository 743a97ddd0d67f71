package com.flagship.settlement.webhook;

import java.util.Set;

/**
 * Applies one family of provider events to local state.
 *
 * Implementations run inside the idempotent processing transaction and must
 * tolerate being invoked again for an event they already applied.
 */
public interface WebhookEventHandler {

    Set<String> supportedEventTypes();

    void handle(ProviderEvent event);
}
