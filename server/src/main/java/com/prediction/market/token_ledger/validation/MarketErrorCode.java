package com.prediction.market.token_ledger.validation;

public enum MarketErrorCode {
    TITLE_REQUIRED,
    TITLE_TOO_SHORT,
    TITLE_TOO_LONG,
    SUBJECTIVE_LANGUAGE,
    DESCRIPTION_REQUIRED,
    DESCRIPTION_TOO_SHORT,
    DESCRIPTION_TOO_LONG,
    END_DATE_REQUIRED,
    INVALID_END_DATE,
    END_DATE_TOO_FAR,
    OPTIONS_REQUIRED,
    INVALID_OPTION_COUNT,
    EMPTY_OPTION_TEXT,
    OPTION_TOO_LONG,
    DUPLICATE_OPTIONS,

    // warnings
    AMBIGUOUS_LANGUAGE,
    END_DATE_VERY_SOON,
    END_DATE_FAR_FUTURE,
    SIMILAR_OPTIONS,
    VAGUE_OPTION_TEXT
}
