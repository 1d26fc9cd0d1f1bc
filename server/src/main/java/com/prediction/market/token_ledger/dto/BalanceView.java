package com.prediction.market.token_ledger.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * Balance with the display strings the UI shows next to the raw numbers.
 */
@Getter
@Builder
@AllArgsConstructor
public class BalanceView {
    private final String userId;
    private final double availableTokens;
    private final double committedTokens;
    private final double totalEarned;
    private final double totalSpent;
    private final double totalBalance;
    private final double netProfitLoss;
    private final String formattedAvailable;
    private final String formattedCommitted;
    private final String formattedTotal;
    private final String formattedNetProfitLoss;
    private final long version;
    private final long lastUpdated;
}
