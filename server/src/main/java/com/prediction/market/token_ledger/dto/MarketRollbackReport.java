package com.prediction.market.token_ledger.dto;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class MarketRollbackReport {
    private String marketId;
    private int commitmentsFound;
    private int refundedCount;
    private double totalRefunded;
    private List<String> failures = new ArrayList<>();
}
