package com.prediction.market.token_ledger.entity;

import java.util.Map;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Market distribution at commitment time. The yes/no fields describe the first two options;
 * the per-option maps are only filled for markets with more than two options.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class OddsSnapshot {

    private double yesOdds;
    private double noOdds;
    private double totalYesTokens;
    private double totalNoTokens;
    private int totalParticipants;

    private Map<String, Double> optionOdds;
    private Map<String, Double> optionTokens;
    private Map<String, Integer> optionParticipants;
}
