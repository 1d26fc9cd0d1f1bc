package com.prediction.market.token_ledger.engine;

import java.util.Optional;

import com.prediction.market.token_ledger.entity.MarketOption;
import com.prediction.market.token_ledger.entity.Position;
import com.prediction.market.token_ledger.validation.ValidationError;
import com.prediction.market.token_ledger.validation.ValidationWarning;

/**
 * Result of mapping a request's position/optionId onto a market option:
 * either a resolved option with its derived position, or an error.
 */
public final class OptionResolution {

    private final MarketOption option;
    private final int index;
    private final Position position;
    private final ValidationError error;
    private final ValidationWarning warning;

    private OptionResolution(MarketOption option, int index, Position position,
            ValidationError error, ValidationWarning warning) {
        this.option = option;
        this.index = index;
        this.position = position;
        this.error = error;
        this.warning = warning;
    }

    static OptionResolution resolved(MarketOption option, int index, Position position, ValidationWarning warning) {
        return new OptionResolution(option, index, position, null, warning);
    }

    static OptionResolution failed(ValidationError error) {
        return new OptionResolution(null, -1, null, error, null);
    }

    public boolean isResolved() {
        return error == null;
    }

    public MarketOption getOption() {
        return option;
    }

    public int getIndex() {
        return index;
    }

    public Position getPosition() {
        return position;
    }

    public Optional<ValidationError> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<ValidationWarning> getWarning() {
        return Optional.ofNullable(warning);
    }
}
