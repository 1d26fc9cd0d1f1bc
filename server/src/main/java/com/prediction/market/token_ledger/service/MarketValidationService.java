package com.prediction.market.token_ledger.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.prediction.market.token_ledger.dto.MarketCreationRequest;
import com.prediction.market.token_ledger.validation.MarketErrorCode;
import com.prediction.market.token_ledger.validation.ValidationError;
import com.prediction.market.token_ledger.validation.ValidationResult;
import com.prediction.market.token_ledger.validation.ValidationWarning;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Checks that a proposed market can be resolved from verifiable evidence.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketValidationService {

    public static final int MIN_TITLE_LENGTH = 10;
    public static final int MAX_TITLE_LENGTH = 200;
    public static final int MIN_DESCRIPTION_LENGTH = 20;
    public static final int MAX_DESCRIPTION_LENGTH = 2000;
    public static final int MIN_OPTIONS = 2;
    public static final int MAX_OPTIONS = 5;
    public static final int MAX_OPTION_LENGTH = 100;
    public static final double SIMILARITY_THRESHOLD = 0.8;

    private static final long DAY_MS = 24L * 60 * 60 * 1000;

    static final List<String> SUBJECTIVE_WORDS = List.of(
            "best", "worst", "better", "worse", "good", "bad", "great", "terrible",
            "amazing", "awful", "excellent", "poor", "outstanding", "horrible",
            "fantastic", "disappointing", "superior", "inferior", "perfect", "flawed",
            "beautiful", "ugly", "attractive", "unattractive", "impressive", "unimpressive",
            "successful", "unsuccessful", "popular", "unpopular", "favorite", "least favorite");

    static final List<String> AMBIGUOUS_WORDS = List.of(
            "soon", "later", "eventually", "might", "could", "possibly", "probably",
            "likely", "unlikely", "maybe", "perhaps", "around", "approximately",
            "about", "roughly", "some", "many", "few", "several", "most", "majority");

    static final List<String> VAGUE_OPTION_WORDS = List.of(
            "other", "something else", "different", "alternative", "various", "multiple",
            "some", "any", "none of the above", "depends");

    private static final Set<String> CRITICAL_CODES = Set.of(
            MarketErrorCode.SUBJECTIVE_LANGUAGE.name(),
            MarketErrorCode.INVALID_END_DATE.name(),
            MarketErrorCode.INVALID_OPTION_COUNT.name(),
            MarketErrorCode.TITLE_REQUIRED.name(),
            MarketErrorCode.END_DATE_REQUIRED.name(),
            MarketErrorCode.OPTIONS_REQUIRED.name());

    private final Clock clock;

    public ValidationResult validateMarket(MarketCreationRequest request) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        validateTitle(request.getTitle(), errors, warnings);
        validateDescription(request.getDescription(), errors);
        validateEndDate(request.getEndDate(), errors, warnings);
        validateOptions(request.getOptions(), errors, warnings);

        if (!errors.isEmpty()) {
            log.debug("Market validation failed with {} error(s)", errors.size());
        }
        return ValidationResult.of(errors, warnings);
    }

    /**
     * Validate a single field of the request for real-time feedback. Unknown fields pass.
     */
    public ValidationResult validateField(String field, MarketCreationRequest request) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();
        switch (field) {
            case "title" -> validateTitle(request.getTitle(), errors, warnings);
            case "description" -> validateDescription(request.getDescription(), errors);
            case "endDate" -> validateEndDate(request.getEndDate(), errors, warnings);
            case "options" -> validateOptions(request.getOptions(), errors, warnings);
            default -> {
                // nothing to check
            }
        }
        return ValidationResult.of(errors, warnings);
    }

    /**
     * A market is resolvable when none of the critical errors apply; length problems alone
     * do not make it unresolvable.
     */
    public boolean isResolvable(MarketCreationRequest request) {
        return validateMarket(request).getErrors().stream()
                .noneMatch(e -> CRITICAL_CODES.contains(e.getCode()));
    }

    private void validateTitle(String title, List<ValidationError> errors, List<ValidationWarning> warnings) {
        if (title == null || title.trim().isEmpty()) {
            errors.add(ValidationError.of("title", MarketErrorCode.TITLE_REQUIRED, "Market title is required"));
            return;
        }
        String trimmed = title.trim();
        if (trimmed.length() < MIN_TITLE_LENGTH) {
            errors.add(ValidationError.of("title", MarketErrorCode.TITLE_TOO_SHORT,
                    String.format("Market title must be at least %d characters long", MIN_TITLE_LENGTH)));
        }
        if (trimmed.length() > MAX_TITLE_LENGTH) {
            errors.add(ValidationError.of("title", MarketErrorCode.TITLE_TOO_LONG,
                    String.format("Market title cannot exceed %d characters", MAX_TITLE_LENGTH)));
        }
        if (!trimmed.endsWith("?")) {
            warnings.add(ValidationWarning.of("title", MarketErrorCode.AMBIGUOUS_LANGUAGE,
                    "Market titles should be phrased as questions for clarity"));
        }

        List<String> subjective = findWords(trimmed, SUBJECTIVE_WORDS);
        if (!subjective.isEmpty()) {
            errors.add(ValidationError.of("title", MarketErrorCode.SUBJECTIVE_LANGUAGE,
                    "Avoid subjective terms: " + quote(subjective)
                            + ". Markets need clear, factual outcomes that can be verified with evidence."));
        }
        List<String> ambiguous = findWords(trimmed, AMBIGUOUS_WORDS);
        if (!ambiguous.isEmpty()) {
            warnings.add(ValidationWarning.of("title", MarketErrorCode.AMBIGUOUS_LANGUAGE,
                    "Consider being more specific. Ambiguous terms detected: " + quote(ambiguous)
                            + ". Use specific dates, numbers, or criteria."));
        }
    }

    private void validateDescription(String description, List<ValidationError> errors) {
        if (description == null || description.trim().isEmpty()) {
            errors.add(ValidationError.of("description", MarketErrorCode.DESCRIPTION_REQUIRED,
                    "Market description is required"));
            return;
        }
        int length = description.trim().length();
        if (length < MIN_DESCRIPTION_LENGTH) {
            errors.add(ValidationError.of("description", MarketErrorCode.DESCRIPTION_TOO_SHORT,
                    String.format("Market description must be at least %d characters long to provide sufficient context",
                            MIN_DESCRIPTION_LENGTH)));
        }
        if (length > MAX_DESCRIPTION_LENGTH) {
            errors.add(ValidationError.of("description", MarketErrorCode.DESCRIPTION_TOO_LONG,
                    String.format("Market description cannot exceed %d characters", MAX_DESCRIPTION_LENGTH)));
        }
    }

    private void validateEndDate(Long endDate, List<ValidationError> errors, List<ValidationWarning> warnings) {
        if (endDate == null) {
            errors.add(ValidationError.of("endDate", MarketErrorCode.END_DATE_REQUIRED,
                    "Markets must have a specific end date when the outcome will be known"));
            return;
        }
        long now = clock.millis();
        double days = (endDate - now) / (double) DAY_MS;

        if (endDate <= now) {
            errors.add(ValidationError.of("endDate", MarketErrorCode.INVALID_END_DATE,
                    "Market end date must be in the future"));
        }
        if (days > 365) {
            errors.add(ValidationError.of("endDate", MarketErrorCode.END_DATE_TOO_FAR,
                    "Market end date cannot be more than 12 months in the future"));
        }
        if (days > 0 && days < 1) {
            warnings.add(ValidationWarning.of("endDate", MarketErrorCode.END_DATE_VERY_SOON,
                    "Market ends very soon (less than 24 hours). Consider extending to allow more participation."));
        }
        if (days > 180) {
            warnings.add(ValidationWarning.of("endDate", MarketErrorCode.END_DATE_FAR_FUTURE,
                    "Market ends far in the future (more than 6 months). Long-term markets may be harder to predict accurately."));
        }
    }

    private void validateOptions(List<String> options, List<ValidationError> errors, List<ValidationWarning> warnings) {
        if (options == null || options.isEmpty()) {
            errors.add(ValidationError.of("options", MarketErrorCode.OPTIONS_REQUIRED,
                    "Markets must have prediction options"));
            return;
        }
        if (options.size() < MIN_OPTIONS) {
            errors.add(ValidationError.of("options", MarketErrorCode.INVALID_OPTION_COUNT,
                    String.format("Markets must have at least %d options", MIN_OPTIONS)));
        }
        if (options.size() > MAX_OPTIONS) {
            errors.add(ValidationError.of("options", MarketErrorCode.INVALID_OPTION_COUNT,
                    String.format("Markets cannot have more than %d options to keep them simple and focused", MAX_OPTIONS)));
        }

        List<String> texts = options.stream()
                .map(o -> o == null ? "" : o.trim())
                .toList();
        if (texts.stream().anyMatch(String::isEmpty)) {
            errors.add(ValidationError.of("options", MarketErrorCode.EMPTY_OPTION_TEXT, "All options must have text"));
        }
        if (texts.stream().anyMatch(t -> t.length() > MAX_OPTION_LENGTH)) {
            errors.add(ValidationError.of("options", MarketErrorCode.OPTION_TOO_LONG,
                    String.format("Options cannot exceed %d characters", MAX_OPTION_LENGTH)));
        }

        Set<String> seen = new HashSet<>();
        boolean duplicate = texts.stream()
                .filter(t -> !t.isEmpty())
                .map(t -> t.toLowerCase(Locale.ROOT))
                .anyMatch(t -> !seen.add(t));
        if (duplicate) {
            errors.add(ValidationError.of("options", MarketErrorCode.DUPLICATE_OPTIONS,
                    "Options must be unique and mutually exclusive"));
        }

        for (int i = 0; i < texts.size(); i++) {
            for (int j = i + 1; j < texts.size(); j++) {
                String a = texts.get(i).toLowerCase(Locale.ROOT);
                String b = texts.get(j).toLowerCase(Locale.ROOT);
                // exact duplicates are already an error
                if (!a.equals(b) && similarity(a, b) > SIMILARITY_THRESHOLD) {
                    warnings.add(ValidationWarning.of("options", MarketErrorCode.SIMILAR_OPTIONS,
                            String.format("Options \"%s\" and \"%s\" are very similar. Consider making them more distinct.",
                                    texts.get(i), texts.get(j))));
                }
            }
        }

        for (String text : texts) {
            List<String> vague = findWords(text, VAGUE_OPTION_WORDS);
            if (!vague.isEmpty()) {
                warnings.add(ValidationWarning.of("options", MarketErrorCode.VAGUE_OPTION_TEXT,
                        String.format("Option \"%s\" contains vague terms: %s. Consider being more specific for clearer resolution.",
                                text, quote(vague))));
            }
        }
    }

    /**
     * Whole-word, case-insensitive matches of {@code words} in {@code text}.
     */
    static List<String> findWords(String text, List<String> words) {
        String lower = text.toLowerCase(Locale.ROOT);
        return words.stream()
                .filter(w -> Pattern.compile("\\b" + Pattern.quote(w) + "\\b").matcher(lower).find())
                .toList();
    }

    /**
     * 1 minus the Levenshtein distance over the longer length.
     */
    static double similarity(String a, String b) {
        if (a.isEmpty()) {
            return b.isEmpty() ? 1 : 0;
        }
        if (b.isEmpty()) {
            return 0;
        }
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(previous[j] + 1, current[j - 1] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return 1 - (double) previous[b.length()] / Math.max(a.length(), b.length());
    }

    private static String quote(List<String> words) {
        return words.stream().map(w -> "\"" + w + "\"").collect(Collectors.joining(", "));
    }
}
