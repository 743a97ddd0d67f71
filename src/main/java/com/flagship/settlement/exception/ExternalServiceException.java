package com.flagship.settlement.exception;

import lombok.Getter;

/**
 * The payment provider rejected a request, failed, or did not answer in time.
 */
@Getter
public class ExternalServiceException extends SettlementException {

    private final boolean timeout;

    public ExternalServiceException(String message, boolean timeout, Throwable cause) {
        super(SettlementErrorCode.PROVIDER_FAILURE, message, cause);
        this.timeout = timeout;
    }
}
