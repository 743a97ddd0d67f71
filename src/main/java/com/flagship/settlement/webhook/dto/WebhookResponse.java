package com.flagship.settlement.webhook.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement.webhook.WebhookOutcome;
import com.flagship.settlement.webhook.WebhookReceipt;
import lombok.Value;

@Value
public class WebhookResponse {

    @JsonProperty("received")
    boolean received;

    @JsonProperty("event_type")
    String eventType;

    @JsonProperty("outcome")
    WebhookOutcome outcome;

    public static WebhookResponse from(WebhookReceipt receipt) {
        return new WebhookResponse(true, receipt.getEventType(), receipt.getOutcome());
    }
}
