package com.prediction.market.token_ledger.validation;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * A single field-tagged validation failure. {@code code} is the name of the validator's error code.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class ValidationError {
    private final String field;
    private final String code;
    private final String message;

    public static ValidationError of(String field, Enum<?> code, String message) {
        return new ValidationError(field, code.name(), message);
    }
}
