package com.flagship.settlement.exception;

public class InvalidSignatureException extends SettlementException {

    public InvalidSignatureException(String message) {
        super(SettlementErrorCode.INVALID_SIGNATURE, message);
    }

    public InvalidSignatureException(String message, Throwable cause) {
        super(SettlementErrorCode.INVALID_SIGNATURE, message, cause);
    }
}
