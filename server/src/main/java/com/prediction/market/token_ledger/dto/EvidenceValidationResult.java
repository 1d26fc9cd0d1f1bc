package com.prediction.market.token_ledger.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.prediction.market.token_ledger.validation.ValidationError;
import com.prediction.market.token_ledger.validation.ValidationWarning;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Validation outcome plus the sanitised text that is safe to store.
 */
@Getter
@AllArgsConstructor
public class EvidenceValidationResult {
    private final List<ValidationError> errors;
    private final List<ValidationWarning> warnings;
    private final String sanitizedContent;

    @JsonProperty("isValid")
    public boolean isValid() {
        return errors.isEmpty();
    }
}
