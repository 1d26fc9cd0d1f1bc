package com.prediction.market.token_ledger.dto;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EvidenceType {
    URL,
    DESCRIPTION,
    SCREENSHOT;

    @JsonCreator
    public static EvidenceType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return EvidenceType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
