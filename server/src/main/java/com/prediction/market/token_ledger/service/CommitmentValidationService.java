package com.prediction.market.token_ledger.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Service;

import com.prediction.market.token_ledger.config.LedgerProperties;
import com.prediction.market.token_ledger.dto.CommitmentRequest;
import com.prediction.market.token_ledger.engine.OptionResolution;
import com.prediction.market.token_ledger.engine.OptionResolver;
import com.prediction.market.token_ledger.entity.Market;
import com.prediction.market.token_ledger.entity.MarketStatus;
import com.prediction.market.token_ledger.entity.UserBalance;
import com.prediction.market.token_ledger.exception.InsufficientBalanceException;
import com.prediction.market.token_ledger.store.LedgerStore;
import com.prediction.market.token_ledger.store.MarketProvider;
import com.prediction.market.token_ledger.validation.CommitmentErrorCode;
import com.prediction.market.token_ledger.validation.ValidationError;
import com.prediction.market.token_ledger.validation.ValidationResult;
import com.prediction.market.token_ledger.validation.ValidationWarning;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Commitment validation.
 *
 * Every check runs and every failure is collected, so a caller sees all problems at once.
 * Validation is read-only; the creation path runs it again inside its transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommitmentValidationService {

    private final MarketProvider marketProvider;
    private final LedgerStore ledgerStore;
    private final LedgerProperties properties;
    private final Clock clock;

    /**
     * Validate a commitment request against the current market and stored balance.
     *
     * @param request the proposed commitment
     * @return all errors, plus warnings such as an existing stake on the same market
     */
    public ValidationResult validate(CommitmentRequest request) {
        String marketId = request.resolveMarketId();
        Market market = marketId == null ? null : marketProvider.getMarket(marketId).orElse(null);
        UserBalance balance = isBlank(request.getUserId())
                ? null
                : ledgerStore.getBalance(request.getUserId()).orElse(null);

        ValidationResult result = validate(request, market, balance);
        if (result.isValid() && marketId != null && hasActiveCommitment(request.getUserId(), marketId)) {
            List<ValidationWarning> warnings = new ArrayList<>(result.getWarnings());
            warnings.add(ValidationWarning.of("predictionId", CommitmentErrorCode.DUPLICATE_COMMITMENT,
                    "You already have an active commitment on this market"));
            return ValidationResult.of(result.getErrors(), warnings);
        }
        return result;
    }

    /**
     * Validate against an already loaded market and balance. Either may be null.
     */
    public ValidationResult validate(CommitmentRequest request, Market market, UserBalance balance) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        // 1. Caller identity
        if (isBlank(request.getUserId())) {
            errors.add(ValidationError.of("userId", CommitmentErrorCode.INVALID_USER, "User ID is required"));
        }

        // 2. Market existence and state
        validateMarket(request.resolveMarketId(), market, errors);

        // 3. Option / position
        if (market != null) {
            validateOption(request, market, errors, warnings);
        }

        // 4. Amount
        boolean amountValid = validateAmount(request.getTokensToCommit(), errors);

        // 5. Balance
        if (amountValid && !isBlank(request.getUserId())) {
            validateBalance(balance, request.getTokensToCommit(), errors);
        }

        if (!errors.isEmpty()) {
            log.warn("Commitment validation failed: {} (userId={}, marketId={})",
                    ValidationResult.of(errors, warnings).getErrorMessage(),
                    request.getUserId(), request.resolveMarketId());
        }
        return ValidationResult.of(errors, warnings);
    }

    private void validateMarket(String marketId, Market market, List<ValidationError> errors) {
        if (marketId == null || marketId.isEmpty()) {
            errors.add(ValidationError.of("predictionId", CommitmentErrorCode.MARKET_NOT_FOUND, "Market ID is required"));
            return;
        }
        if (market == null) {
            errors.add(ValidationError.of("predictionId", CommitmentErrorCode.MARKET_NOT_FOUND,
                    "Market not found: " + marketId));
            return;
        }
        if (market.getStatus() != MarketStatus.ACTIVE) {
            String status = market.getStatus() == null ? "unknown" : market.getStatus().name().toLowerCase(Locale.ROOT);
            errors.add(ValidationError.of("predictionId", CommitmentErrorCode.MARKET_CLOSED,
                    "Market is not active (status: " + status + ")"));
        }
        if (market.getEndDate() == null) {
            errors.add(ValidationError.of("predictionId", CommitmentErrorCode.MARKET_CLOSED,
                    "Market has no end date"));
        } else if (market.getEndDate() <= clock.millis()) {
            errors.add(ValidationError.of("predictionId", CommitmentErrorCode.MARKET_CLOSED,
                    "Market has already ended"));
        }
    }

    private void validateOption(CommitmentRequest request, Market market,
            List<ValidationError> errors, List<ValidationWarning> warnings) {
        if (!market.hasOptions()) {
            warnings.add(ValidationWarning.of("optionId", CommitmentErrorCode.LEGACY_OPTIONS,
                    "Market has no options; using legacy yes/no options"));
        }
        OptionResolution resolution = OptionResolver.resolve(market, request.getPosition(), request.getOptionId());
        resolution.getError().ifPresent(errors::add);
        resolution.getWarning().ifPresent(warnings::add);
    }

    private boolean validateAmount(Double tokens, List<ValidationError> errors) {
        if (tokens == null || tokens.isNaN() || tokens.isInfinite()) {
            errors.add(ValidationError.of("tokensToCommit", CommitmentErrorCode.INVALID_AMOUNT,
                    "Tokens to commit must be a number"));
            return false;
        }
        if (tokens <= 0 || tokens != Math.rint(tokens)) {
            errors.add(ValidationError.of("tokensToCommit", CommitmentErrorCode.INVALID_AMOUNT,
                    "Tokens to commit must be a positive whole number"));
            return false;
        }
        LedgerProperties.Commitment limits = properties.getCommitment();
        if (tokens < limits.getMinTokens()) {
            errors.add(ValidationError.of("tokensToCommit", CommitmentErrorCode.INVALID_AMOUNT,
                    String.format("Minimum commitment is %d tokens", limits.getMinTokens())));
            return false;
        }
        if (tokens > limits.getMaxTokens()) {
            errors.add(ValidationError.of("tokensToCommit", CommitmentErrorCode.INVALID_AMOUNT,
                    String.format("Maximum commitment is %d tokens", limits.getMaxTokens())));
            return false;
        }
        return true;
    }

    private void validateBalance(UserBalance balance, double tokens, List<ValidationError> errors) {
        // a user without a balance record has nothing to spend
        double available = balance == null || balance.getAvailableTokens() == null
                ? 0
                : balance.getAvailableTokens();
        if (Double.isNaN(available) || available < tokens) {
            errors.add(ValidationError.of("tokensToCommit", CommitmentErrorCode.INSUFFICIENT_BALANCE,
                    InsufficientBalanceException.describe(Double.isNaN(available) ? 0 : available, tokens)));
        }
    }

    private boolean hasActiveCommitment(String userId, String marketId) {
        return ledgerStore.listActiveCommitments(userId).stream()
                .anyMatch(c -> marketId.equals(c.getPredictionId()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
