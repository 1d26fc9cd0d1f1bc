package com.prediction.market.token_ledger.dto;

import com.prediction.market.token_ledger.entity.UserBalance;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class BalanceFixResult {
    private final String userId;
    private final boolean changed;
    private final UserBalance previous;
    private final UserBalance current;
}
