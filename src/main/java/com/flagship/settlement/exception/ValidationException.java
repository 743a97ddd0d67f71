package com.flagship.settlement.exception;

/**
 * Malformed input or a request the business rules refuse outright
 * (self-purchase, bad fee configuration, insufficient balance).
 */
public class ValidationException extends SettlementException {

    public ValidationException(SettlementErrorCode code, String message) {
        super(code, message);
    }
}
