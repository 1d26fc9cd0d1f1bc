package com.prediction.market.token_ledger.entity;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CommitmentSource {
    WEB,
    MOBILE,
    API;

    @JsonCreator
    public static CommitmentSource fromValue(String value) {
        if (value == null || value.isBlank()) {
            return WEB;
        }
        return CommitmentSource.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
