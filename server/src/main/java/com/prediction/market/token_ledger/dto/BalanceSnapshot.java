package com.prediction.market.token_ledger.dto;

import com.prediction.market.token_ledger.entity.UserBalance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@AllArgsConstructor
public class BalanceSnapshot {
    private final String userId;
    private final long timestamp;
    private final UserBalance balance;
    private final int transactionCount;
    private final int commitmentCount;
    private final UserBalance calculatedBalance;
    private final boolean consistent;
}
