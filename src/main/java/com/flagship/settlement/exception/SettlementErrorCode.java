package com.flagship.settlement.exception;

/**
 * Machine-readable error codes returned to API clients and written to logs.
 */
public enum SettlementErrorCode {
    // Validation: rejected synchronously, nothing persisted
    INVALID_FEE_CONFIGURATION,
    INVALID_OPERATION,
    OUT_OF_STOCK,
    INVALID_COMMISSION,
    UNSUPPORTED_COMMISSION_TYPE,
    NO_PAYOUT_DESTINATION,
    INSUFFICIENT_BALANCE,

    NOT_FOUND,

    // Conflict: state machine precondition violated, original state preserved
    CONFLICTING_STATE,
    INVALID_STATE,
    ALREADY_CONVERTED,
    CAMPAIGN_INACTIVE,
    CONVERSION_LIMIT_REACHED,
    TRANSACTION_NOT_SUCCEEDED,

    PROVIDER_FAILURE,
    RECONCILIATION_REQUIRED,
    INVALID_SIGNATURE
}
