package com.flagship.settlement.reconciliation;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ReconciliationAlert {
    UUID id;
    AlertType alertType;
    String reference;
    String detail;
    boolean resolved;
    Instant createdAt;
}
