package com.prediction.market.token_ledger.entity;

public enum TransactionStatus {
    PENDING,
    COMPLETED,
    FAILED
}
