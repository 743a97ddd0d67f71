package com.flagship.settlement.exception;

public class NotFoundException extends SettlementException {

    public NotFoundException(String message) {
        super(SettlementErrorCode.NOT_FOUND, message);
    }

    public static NotFoundException of(String type, Object id) {
        return new NotFoundException(type + " not found: " + id);
    }
}
