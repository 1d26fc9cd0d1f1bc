package com.prediction.market.token_ledger.engine;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.prediction.market.token_ledger.entity.Market;
import com.prediction.market.token_ledger.entity.MarketOption;
import com.prediction.market.token_ledger.entity.Position;
import com.prediction.market.token_ledger.validation.CommitmentErrorCode;
import com.prediction.market.token_ledger.validation.ValidationError;
import com.prediction.market.token_ledger.validation.ValidationWarning;

/**
 * Maps the legacy yes/no slot and explicit option ids onto a market's options.
 *
 * Binary markets: yes is the first option, no the second, in both directions.
 * Markets with more options: an explicit optionId is authoritative. A position-only
 * request is accepted only when keyword matching picks exactly one option; anything
 * else is rejected as ambiguous.
 */
public final class OptionResolver {

    static final Set<String> YES_KEYWORDS = Set.of("yes", "stay", "together", "will", "true", "positive");
    static final Set<String> NO_KEYWORDS = Set.of("no", "break", "up", "wont", "false", "negative");

    private static final List<MarketOption> LEGACY_BINARY_OPTIONS = List.of(
            MarketOption.builder().id("yes").text("Yes").build(),
            MarketOption.builder().id("no").text("No").build());

    private OptionResolver() {
    }

    /**
     * Options of the market, or synthetic yes/no options for legacy markets that carry none.
     */
    public static List<MarketOption> effectiveOptions(Market market) {
        return market.hasOptions() ? market.getOptions() : LEGACY_BINARY_OPTIONS;
    }

    public static Position positionForIndex(int index) {
        return index == 0 ? Position.YES : Position.NO;
    }

    public static OptionResolution resolve(Market market, Position position, String optionId) {
        List<MarketOption> options = effectiveOptions(market);
        boolean binary = options.size() == 2;

        if (optionId != null && !optionId.isBlank()) {
            int index = indexOf(options, optionId);
            if (index < 0) {
                return OptionResolution.failed(ValidationError.of("optionId", CommitmentErrorCode.OPTION_NOT_FOUND,
                        "Option not found: " + optionId));
            }
            Position derived = positionForIndex(index);
            ValidationWarning warning = null;
            if (position != null && position != derived) {
                if (binary) {
                    return OptionResolution.failed(ValidationError.of("position",
                            CommitmentErrorCode.POSITION_OPTION_MISMATCH,
                            String.format("Position %s does not match option %s", position.toValue(), optionId)));
                }
                warning = ValidationWarning.of("position", CommitmentErrorCode.POSITION_REDERIVED,
                        String.format("Position %s replaced by %s derived from option %s",
                                position.toValue(), derived.toValue(), optionId));
            }
            return OptionResolution.resolved(options.get(index), index, derived, warning);
        }

        if (position == null) {
            return OptionResolution.failed(ValidationError.of("optionId", CommitmentErrorCode.OPTION_NOT_FOUND,
                    "Either position or optionId is required"));
        }
        if (options.size() < 2) {
            return OptionResolution.failed(ValidationError.of("optionId", CommitmentErrorCode.OPTION_NOT_FOUND,
                    "Market must have at least two options"));
        }
        if (binary) {
            int index = position == Position.YES ? 0 : 1;
            return OptionResolution.resolved(options.get(index), index, position, null);
        }

        Set<String> keywords = position == Position.YES ? YES_KEYWORDS : NO_KEYWORDS;
        List<Integer> matches = IntStream.range(0, options.size())
                .filter(i -> matchesKeyword(options.get(i).getText(), keywords))
                .boxed()
                .collect(Collectors.toList());
        if (matches.size() != 1) {
            return OptionResolution.failed(ValidationError.of("optionId", CommitmentErrorCode.AMBIGUOUS_POSITION,
                    "Option ID is required for markets with more than two options"));
        }
        int index = matches.get(0);
        MarketOption option = options.get(index);
        return OptionResolution.resolved(option, index, position,
                ValidationWarning.of("position", CommitmentErrorCode.KEYWORD_MATCH,
                        String.format("Position %s mapped to option '%s' by keyword", position.toValue(), option.getText())));
    }

    static boolean matchesKeyword(String text, Set<String> keywords) {
        if (text == null) {
            return false;
        }
        String normalized = text.toLowerCase(Locale.ROOT).replace("'", "").replace("’", "");
        return Arrays.stream(normalized.split("[^a-z0-9]+")).anyMatch(keywords::contains);
    }

    private static int indexOf(List<MarketOption> options, String optionId) {
        for (int i = 0; i < options.size(); i++) {
            if (optionId.equals(options.get(i).getId())) {
                return i;
            }
        }
        return -1;
    }
}
