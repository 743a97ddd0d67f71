package com.flagship.settlement.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Local persistence failed after an external side effect had already happened.
 * Never retried automatically; an operator alert has been recorded.
 */
@Getter
public class ReconciliationAlertException extends SettlementException {

    private final UUID alertId;

    public ReconciliationAlertException(UUID alertId, String message, Throwable cause) {
        super(SettlementErrorCode.RECONCILIATION_REQUIRED, message, cause);
        this.alertId = alertId;
    }
}
