package com.prediction.market.token_ledger.service;

import static com.prediction.market.token_ledger.LedgerTestFixtures.DAY_MS;
import static com.prediction.market.token_ledger.LedgerTestFixtures.NOW;
import static com.prediction.market.token_ledger.LedgerTestFixtures.fixedClock;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.prediction.market.token_ledger.dto.MarketCreationRequest;
import com.prediction.market.token_ledger.validation.MarketErrorCode;
import com.prediction.market.token_ledger.validation.ValidationError;
import com.prediction.market.token_ledger.validation.ValidationResult;
import com.prediction.market.token_ledger.validation.ValidationWarning;

class MarketValidationServiceTest {

    private final MarketValidationService service = new MarketValidationService(fixedClock());

    @Test
    @DisplayName("a specific, dated question with distinct options is valid with no warnings")
    void validMarket() {
        ValidationResult result = service.validateMarket(request());

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    @DisplayName("subjective titles are errors, ambiguous wording and missing question marks are warnings")
    void titleLanguage() {
        ValidationResult subjective = service.validateMarket(request().toBuilder()
                .title("Is Drake the best rapper alive?").build());
        ValidationResult ambiguous = service.validateMarket(request().toBuilder()
                .title("Drake will probably release an album").build());

        assertThat(subjective.getErrors()).singleElement().satisfies(e -> {
            assertThat(e.getCode()).isEqualTo(MarketErrorCode.SUBJECTIVE_LANGUAGE.name());
            assertThat(e.getMessage()).startsWith("Avoid subjective terms: \"best\"");
        });
        assertThat(ambiguous.isValid()).isTrue();
        assertThat(ambiguous.getWarnings()).extracting(ValidationWarning::getMessage).containsExactly(
                "Market titles should be phrased as questions for clarity",
                "Consider being more specific. Ambiguous terms detected: \"probably\". Use specific dates, numbers, or criteria.");
    }

    @Test
    @DisplayName("word lists match whole words only")
    void wholeWords() {
        assertThat(MarketValidationService.findWords("Will the goodbye tour sell out?", MarketValidationService.SUBJECTIVE_WORDS))
                .isEmpty();
        assertThat(MarketValidationService.findWords("Who is your least favorite?", MarketValidationService.SUBJECTIVE_WORDS))
                .containsExactly("favorite", "least favorite");
    }

    @Test
    @DisplayName("missing and short fields are each reported")
    void requiredFields() {
        ValidationResult result = service.validateMarket(MarketCreationRequest.builder()
                .title("Short?")
                .description("Too short")
                .build());

        assertThat(result.getErrors()).extracting(ValidationError::getCode).containsExactly(
                MarketErrorCode.TITLE_TOO_SHORT.name(),
                MarketErrorCode.DESCRIPTION_TOO_SHORT.name(),
                MarketErrorCode.END_DATE_REQUIRED.name(),
                MarketErrorCode.OPTIONS_REQUIRED.name());
    }

    @Test
    @DisplayName("end dates must be in the future and within a year")
    void endDateBounds() {
        long now = NOW.toEpochMilli();

        assertThat(service.validateField("endDate", request().toBuilder().endDate(now).build()).getErrors())
                .extracting(ValidationError::getCode).containsExactly(MarketErrorCode.INVALID_END_DATE.name());
        assertThat(service.validateField("endDate", request().toBuilder().endDate(now + 400 * DAY_MS).build()).getErrors())
                .extracting(ValidationError::getCode).containsExactly(MarketErrorCode.END_DATE_TOO_FAR.name());

        ValidationResult soon = service.validateField("endDate", request().toBuilder().endDate(now + DAY_MS / 2).build());
        ValidationResult far = service.validateField("endDate", request().toBuilder().endDate(now + 200 * DAY_MS).build());
        assertThat(soon.isValid()).isTrue();
        assertThat(soon.hasWarning(MarketErrorCode.END_DATE_VERY_SOON.name())).isTrue();
        assertThat(far.isValid()).isTrue();
        assertThat(far.hasWarning(MarketErrorCode.END_DATE_FAR_FUTURE.name())).isTrue();
    }

    @Test
    @DisplayName("option count, emptiness and case-insensitive duplicates are errors")
    void optionErrors() {
        ValidationResult tooFew = service.validateField("options", request().toBuilder().options(List.of("Yes")).build());
        ValidationResult tooMany = service.validateField("options",
                request().toBuilder().options(List.of("A1", "B2", "C3", "D4", "E5", "F6")).build());
        ValidationResult duplicate = service.validateField("options",
                request().toBuilder().options(List.of("Yes", "yes ", " ")).build());

        assertThat(tooFew.hasError(MarketErrorCode.INVALID_OPTION_COUNT.name())).isTrue();
        assertThat(tooMany.hasError(MarketErrorCode.INVALID_OPTION_COUNT.name())).isTrue();
        assertThat(duplicate.getErrors()).extracting(ValidationError::getCode).containsExactly(
                MarketErrorCode.EMPTY_OPTION_TEXT.name(),
                MarketErrorCode.DUPLICATE_OPTIONS.name());
    }

    @Test
    @DisplayName("near-identical and vague options are warnings")
    void optionWarnings() {
        ValidationResult result = service.validateField("options",
                request().toBuilder().options(List.of("Before March 1", "Before March 2", "Something else")).build());

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).extracting(ValidationWarning::getCode).containsExactly(
                MarketErrorCode.SIMILAR_OPTIONS.name(),
                MarketErrorCode.VAGUE_OPTION_TEXT.name());
    }

    @Test
    void similarity() {
        assertThat(MarketValidationService.similarity("kitten", "sitting")).isCloseTo(1 - 3.0 / 7, within(1e-9));
        assertThat(MarketValidationService.similarity("", "")).isEqualTo(1.0);
        assertThat(MarketValidationService.similarity("abc", "")).isZero();
    }

    @Test
    @DisplayName("length problems alone do not make a market unresolvable")
    void resolvable() {
        assertThat(service.isResolvable(request().toBuilder().description("short").build())).isTrue();
        assertThat(service.isResolvable(request().toBuilder().title("Will this be the best album of 2026?").build()))
                .isFalse();
        assertThat(service.isResolvable(request().toBuilder().endDate(null).build())).isFalse();
    }

    @Test
    @DisplayName("unknown fields validate clean")
    void unknownField() {
        assertThat(service.validateField("category", request()).isValid()).isTrue();
    }

    private static MarketCreationRequest request() {
        return MarketCreationRequest.builder()
                .title("Will Drake release an album before December 31, 2026?")
                .description("Resolves yes if a studio album is released on major streaming services.")
                .endDate(NOW.toEpochMilli() + 30 * DAY_MS)
                .options(List.of("Yes", "No"))
                .build();
    }
}
