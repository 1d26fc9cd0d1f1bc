package com.prediction.market.token_ledger.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@AllArgsConstructor
public class TransactionSummary {
    private final double totalPurchased;
    private final double totalCommitted;
    private final double totalWon;
    private final double totalLost;
    private final double totalRefunded;

    /** Change in available tokens over the summarised entries. */
    private final double netChange;
    private final int transactionCount;
}
