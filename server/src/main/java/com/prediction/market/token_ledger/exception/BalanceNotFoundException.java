package com.prediction.market.token_ledger.exception;

public class BalanceNotFoundException extends RuntimeException {

    public BalanceNotFoundException(String userId) {
        super("Balance not found for user " + userId);
    }
}
