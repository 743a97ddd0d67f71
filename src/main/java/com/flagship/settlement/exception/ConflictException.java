package com.flagship.settlement.exception;

/**
 * A state machine precondition did not hold. The stored state is left untouched.
 */
public class ConflictException extends SettlementException {

    public ConflictException(SettlementErrorCode code, String message) {
        super(code, message);
    }
}
