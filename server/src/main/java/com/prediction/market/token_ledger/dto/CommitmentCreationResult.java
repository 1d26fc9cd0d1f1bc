package com.prediction.market.token_ledger.dto;

import java.util.List;

import com.prediction.market.token_ledger.entity.PredictionCommitment;
import com.prediction.market.token_ledger.validation.ValidationError;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of a commitment attempt. On failure {@code error} explains why and whether
 * the caller may retry.
 */
@Getter
@AllArgsConstructor
public class CommitmentCreationResult {

    public static final String VALIDATION_FAILED = "VALIDATION_FAILED";
    public static final String CONCURRENT_MODIFICATION = "CONCURRENT_MODIFICATION";
    public static final String CREATION_FAILED = "CREATION_FAILED";

    private final boolean success;
    private final String commitmentId;
    private final PredictionCommitment commitment;
    private final CreationError error;

    public static CommitmentCreationResult success(PredictionCommitment commitment) {
        return new CommitmentCreationResult(true, commitment.getId(), commitment, null);
    }

    public static CommitmentCreationResult failure(String code, String message, boolean retryable,
            List<ValidationError> errors) {
        return new CommitmentCreationResult(false, null, null, new CreationError(code, message, retryable, errors));
    }

    @Getter
    @AllArgsConstructor
    public static class CreationError {
        private final String code;
        private final String message;
        private final boolean retryable;
        private final List<ValidationError> errors;
    }
}
