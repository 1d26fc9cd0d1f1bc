package com.prediction.market.token_ledger.dto;

import java.util.List;

import com.prediction.market.token_ledger.entity.TokenTransaction;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class TransactionHistory {
    private final String userId;
    private final List<TokenTransaction> transactions;
    private final TransactionSummary summary;
}
