package com.prediction.market.token_ledger.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@AllArgsConstructor
public class BalanceHealthReport {
    private final int totalUsers;
    private final int usersWithBalances;
    private final double totalTokensInCirculation;
    private final double totalTokensCommitted;
    private final double averageBalancePerUser;

    /** Share of the audited sample whose stored balance drifted. */
    private final double inconsistencyRate;
    private final int sampleSize;
    private final long generatedAt;
}
