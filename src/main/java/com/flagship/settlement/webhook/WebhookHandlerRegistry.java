package com.flagship.settlement.webhook;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps provider event types to their handler. Built once from every
 * {@link WebhookEventHandler} bean; two handlers claiming the same type fail
 * application startup.
 */
@Component
@Slf4j
public class WebhookHandlerRegistry {

    private final Map<String, WebhookEventHandler> handlers;

    public WebhookHandlerRegistry(List<WebhookEventHandler> handlerBeans) {
        Map<String, WebhookEventHandler> byType = new HashMap<>();
        for (WebhookEventHandler handler : handlerBeans) {
            for (String type : handler.supportedEventTypes()) {
                WebhookEventHandler previous = byType.putIfAbsent(type, handler);
                if (previous != null) {
                    throw new IllegalStateException(String.format(
                        "Event type %s is claimed by both %s and %s", type,
                        previous.getClass().getSimpleName(), handler.getClass().getSimpleName()));
                }
            }
        }
        this.handlers = Collections.unmodifiableMap(byType);
        log.info("Registered webhook handlers for event types {}", handlers.keySet());
    }

    public Optional<WebhookEventHandler> find(String eventType) {
        return Optional.ofNullable(handlers.get(eventType));
    }
}
