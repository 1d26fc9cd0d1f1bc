package com.prediction.market.token_ledger.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a validator run. Errors are collected, never short-circuited,
 * so callers can report every problem at once.
 */
public class ValidationResult {

    private final List<ValidationError> errors;
    private final List<ValidationWarning> warnings;

    private ValidationResult(List<ValidationError> errors, List<ValidationWarning> warnings) {
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public static ValidationResult valid() {
        return new ValidationResult(List.of(), List.of());
    }

    public static ValidationResult of(List<ValidationError> errors, List<ValidationWarning> warnings) {
        return new ValidationResult(errors, warnings);
    }

    @JsonProperty("isValid")
    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    public List<ValidationWarning> getWarnings() {
        return warnings;
    }

    public boolean hasError(String code) {
        return errors.stream().anyMatch(e -> e.getCode().equals(code));
    }

    public boolean hasWarning(String code) {
        return warnings.stream().anyMatch(w -> w.getCode().equals(code));
    }

    @JsonIgnore
    public String getErrorMessage() {
        return errors.stream().map(ValidationError::getMessage).collect(Collectors.joining("; "));
    }
}
