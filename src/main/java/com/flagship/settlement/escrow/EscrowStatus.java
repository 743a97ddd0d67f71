package com.flagship.settlement.escrow;

public enum EscrowStatus {
    HELD,
    DISPUTED,
    RELEASED
}
