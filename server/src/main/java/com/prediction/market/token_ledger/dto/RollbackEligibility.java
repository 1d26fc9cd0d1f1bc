package com.prediction.market.token_ledger.dto;

import com.prediction.market.token_ledger.entity.PredictionCommitment;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Whether a single commitment may still be refunded. {@code reason} is set only when it may not.
 */
@Getter
@AllArgsConstructor
public class RollbackEligibility {
    private final boolean canRollback;
    private final String reason;
    private final PredictionCommitment commitment;

    public static RollbackEligibility allowed(PredictionCommitment commitment) {
        return new RollbackEligibility(true, null, commitment);
    }

    public static RollbackEligibility denied(String reason, PredictionCommitment commitment) {
        return new RollbackEligibility(false, reason, commitment);
    }
}
