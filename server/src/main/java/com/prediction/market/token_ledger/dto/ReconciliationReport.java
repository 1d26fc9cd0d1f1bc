package com.prediction.market.token_ledger.dto;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class ReconciliationReport {
    private int totalUsersChecked;
    private int usersWithInconsistencies;
    private List<BalanceInconsistency> inconsistenciesFound = new ArrayList<>();
    private int usersFixed;
    private List<String> errors = new ArrayList<>();

    /** Wall-clock duration in milliseconds. */
    private long executionTime;
}
