package com.prediction.market.token_ledger.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class BalanceIntegrityResult {
    private final List<String> violations;

    @JsonProperty("isValid")
    public boolean isValid() {
        return violations.isEmpty();
    }
}
