package com.flagship.settlement.webhook;

import lombok.Value;

@Value
public class WebhookReceipt {
    String eventId;
    String eventType;
    WebhookOutcome outcome;
}
