package com.prediction.market.token_ledger.dto;

import java.util.List;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class ReconcileRequest {
    @NotNull
    private List<String> userIds;
}
