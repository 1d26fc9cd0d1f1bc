package com.prediction.market.token_ledger.dto;

import java.util.List;

import com.prediction.market.token_ledger.entity.UserBalance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@AllArgsConstructor
public class BalanceAuditResult {
    private final String userId;
    private final UserBalance storedBalance;
    private final UserBalance calculatedBalance;
    private final List<BalanceInconsistency> inconsistencies;
    private final List<String> integrityViolations;
    private final int transactionCount;
    private final int activeCommitmentCount;
    private final long auditedAt;

    public boolean isConsistent() {
        return inconsistencies.isEmpty();
    }
}
