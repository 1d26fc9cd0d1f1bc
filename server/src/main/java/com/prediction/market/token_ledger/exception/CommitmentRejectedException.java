package com.prediction.market.token_ledger.exception;

import com.prediction.market.token_ledger.validation.ValidationResult;

/**
 * Aborts a commitment transaction when validation inside the transaction fails.
 * Nothing has been written when this is thrown.
 */
public class CommitmentRejectedException extends RuntimeException {

    private final transient ValidationResult validation;

    public CommitmentRejectedException(ValidationResult validation) {
        super("Commitment validation failed: " + validation.getErrorMessage());
        this.validation = validation;
    }

    public ValidationResult getValidation() {
        return validation;
    }
}
