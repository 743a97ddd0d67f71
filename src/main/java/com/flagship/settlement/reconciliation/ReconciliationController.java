package com.flagship.settlement.reconciliation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Open reconciliation alerts, newest first. Operator-facing.
 */
@RestController
@RequiredArgsConstructor
public class ReconciliationController {

    private final ReconciliationAlertService alertService;

    @GetMapping("/api/reconciliation/alerts")
    public List<AlertResponse> openAlerts() {
        return alertService.findOpenAlerts()
            .stream()
            .map(AlertResponse::from)
            .toList();
    }

    @Value
    public static class AlertResponse {
        @JsonProperty("alert_id")
        UUID alertId;

        @JsonProperty("alert_type")
        AlertType alertType;

        @JsonProperty("reference")
        String reference;

        @JsonProperty("detail")
        String detail;

        @JsonProperty("created_at")
        Instant createdAt;

        static AlertResponse from(ReconciliationAlert alert) {
            return new AlertResponse(
                alert.getId(),
                alert.getAlertType(),
                alert.getReference(),
                alert.getDetail(),
                alert.getCreatedAt()
            );
        }
    }
}
