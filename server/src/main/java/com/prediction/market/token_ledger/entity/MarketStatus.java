package com.prediction.market.token_ledger.entity;

public enum MarketStatus {
    DRAFT,
    ACTIVE,
    CLOSED,
    RESOLVED,
    CANCELLED
}
