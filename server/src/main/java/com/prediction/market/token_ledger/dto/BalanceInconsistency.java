package com.prediction.market.token_ledger.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * One field where the stored balance differs from the recomputed one.
 */
@Getter
@ToString
@AllArgsConstructor
public class BalanceInconsistency {
    private final String userId;
    private final String field;
    private final double storedValue;
    private final double calculatedValue;

    /** {@code calculatedValue - storedValue}. */
    private final double difference;
}
