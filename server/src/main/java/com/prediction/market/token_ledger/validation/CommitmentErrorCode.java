package com.prediction.market.token_ledger.validation;

public enum CommitmentErrorCode {
    INVALID_USER,
    MARKET_NOT_FOUND,
    MARKET_CLOSED,
    OPTION_NOT_FOUND,
    AMBIGUOUS_POSITION,
    POSITION_OPTION_MISMATCH,
    INVALID_AMOUNT,
    INSUFFICIENT_BALANCE,

    // warnings
    DUPLICATE_COMMITMENT,
    LEGACY_OPTIONS,
    POSITION_REDERIVED,
    KEYWORD_MATCH
}
