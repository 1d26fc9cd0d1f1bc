package com.prediction.market.token_ledger.validation;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Non-blocking finding reported next to validation errors.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class ValidationWarning {
    private final String field;
    private final String code;
    private final String message;

    public static ValidationWarning of(String field, Enum<?> code, String message) {
        return new ValidationWarning(field, code.name(), message);
    }
}
