package com.flagship.settlement.exception;

import lombok.Getter;

/**
 * Base type for every failure raised by the settlement core.
 *
 * Subclasses correspond to the error categories the REST layer maps to
 * HTTP status codes; the {@link SettlementErrorCode} identifies the exact cause.
 */
@Getter
public abstract class SettlementException extends RuntimeException {

    private final SettlementErrorCode code;

    protected SettlementException(SettlementErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected SettlementException(SettlementErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
