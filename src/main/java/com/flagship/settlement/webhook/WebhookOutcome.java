package com.flagship.settlement.webhook;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What happened to a webhook delivery with a valid signature. Every outcome
 * is acknowledged to the provider with HTTP 200.
 */
public enum WebhookOutcome {
    APPLIED,
    DUPLICATE,
    UNHANDLED,
    FAILED,
    UNPARSEABLE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
