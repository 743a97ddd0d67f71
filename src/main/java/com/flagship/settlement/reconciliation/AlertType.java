package com.flagship.settlement.reconciliation;

public enum AlertType {
    /** Provider accepted a payout that could not be recorded locally. */
    PAYOUT_NOT_RECORDED,
    /** A terminal transition was requested that contradicts the stored state. */
    CONFLICTING_TRANSITION,
    /** A transaction stayed pending longer than the configured window. */
    STALE_PENDING_TRANSACTION,
    /** Released escrow funds could not be transferred to the seller. */
    ESCROW_TRANSFER_FAILED,
    /** A refund took back more than the seller still had unpaid. */
    REFUND_EXCEEDS_BALANCE,
    /** A commission was recorded after its campaign had reached the conversion cap. */
    CONVERSION_OVER_CAP
}
