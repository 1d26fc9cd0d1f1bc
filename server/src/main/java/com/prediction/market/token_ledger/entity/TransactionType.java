package com.prediction.market.token_ledger.entity;

/**
 * Kind of balance-affecting event recorded in the token ledger.
 */
public enum TransactionType {
    PURCHASE,
    COMMIT,
    WIN,
    LOSS,
    REFUND
}
