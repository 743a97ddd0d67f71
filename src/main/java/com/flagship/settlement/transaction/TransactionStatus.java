package com.flagship.settlement.transaction;

public enum TransactionStatus {
    PENDING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
