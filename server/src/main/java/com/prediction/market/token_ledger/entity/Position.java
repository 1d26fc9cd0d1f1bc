package com.prediction.market.token_ledger.entity;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Legacy binary slot of a commitment. "yes" is the market's first option, "no" the second.
 */
public enum Position {
    YES,
    NO;

    @JsonCreator
    public static Position fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Position.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
