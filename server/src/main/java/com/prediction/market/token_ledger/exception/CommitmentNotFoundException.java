package com.prediction.market.token_ledger.exception;

public class CommitmentNotFoundException extends RuntimeException {

    public CommitmentNotFoundException(String commitmentId) {
        super("Commitment not found: " + commitmentId);
    }
}
