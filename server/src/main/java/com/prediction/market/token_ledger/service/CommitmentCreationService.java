package com.prediction.market.token_ledger.service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.prediction.market.token_ledger.dto.ClientInfo;
import com.prediction.market.token_ledger.dto.CommitmentCreationResult;
import com.prediction.market.token_ledger.dto.CommitmentRequest;
import com.prediction.market.token_ledger.engine.BalanceArithmetic;
import com.prediction.market.token_ledger.engine.OptionResolution;
import com.prediction.market.token_ledger.engine.OptionResolver;
import com.prediction.market.token_ledger.entity.CommitmentMetadata;
import com.prediction.market.token_ledger.entity.CommitmentSource;
import com.prediction.market.token_ledger.entity.CommitmentStatus;
import com.prediction.market.token_ledger.entity.Market;
import com.prediction.market.token_ledger.entity.MarketOption;
import com.prediction.market.token_ledger.entity.OddsSnapshot;
import com.prediction.market.token_ledger.entity.Position;
import com.prediction.market.token_ledger.entity.PredictionCommitment;
import com.prediction.market.token_ledger.entity.TokenTransaction;
import com.prediction.market.token_ledger.entity.TransactionType;
import com.prediction.market.token_ledger.entity.UserBalance;
import com.prediction.market.token_ledger.exception.CommitmentRejectedException;
import com.prediction.market.token_ledger.exception.ConcurrentBalanceModificationException;
import com.prediction.market.token_ledger.exception.InsufficientBalanceException;
import com.prediction.market.token_ledger.store.LedgerSession;
import com.prediction.market.token_ledger.store.LedgerStore;
import com.prediction.market.token_ledger.store.MarketProvider;
import com.prediction.market.token_ledger.util.TokenFormatter;
import com.prediction.market.token_ledger.validation.CommitmentErrorCode;
import com.prediction.market.token_ledger.validation.ValidationError;
import com.prediction.market.token_ledger.validation.ValidationResult;

import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates commitments.
 *
 * Each attempt is one ledger transaction: read the balance, validate again, price the stake,
 * debit the balance with a version-guarded write, insert the commitment and append the COMMIT
 * entry. Either all of it lands or none of it does. Version conflicts re-run the whole attempt
 * through the conflict {@link Retry}; once retries are exhausted the caller gets a retryable
 * failure.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommitmentCreationService {

    private final LedgerStore ledgerStore;
    private final MarketProvider marketProvider;
    private final CommitmentValidationService validationService;
    private final Retry ledgerConflictRetry;
    private final Clock clock;

    /**
     * Create a commitment.
     *
     * @param request position and/or optionId, amount and market
     * @return the stored commitment, or the reason it was not created
     */
    public CommitmentCreationResult createCommitment(CommitmentRequest request) {
        CommitmentRequest normalized = normalize(request);

        try {
            PredictionCommitment commitment = Retry.decorateSupplier(ledgerConflictRetry,
                    () -> attemptCommitment(normalized)).get();

            log.info("Commitment created: commitmentId={}, userId={}, marketId={}, optionId={}, tokens={}, odds={}",
                    commitment.getId(), commitment.getUserId(), commitment.getPredictionId(),
                    commitment.getOptionId(), commitment.getTokensCommitted(), TokenFormatter.formatOdds(commitment.getOdds()));
            return CommitmentCreationResult.success(commitment);

        } catch (CommitmentRejectedException e) {
            ValidationResult validation = e.getValidation();
            return CommitmentCreationResult.failure(CommitmentCreationResult.VALIDATION_FAILED,
                    validation.getErrorMessage(), false, validation.getErrors());

        } catch (InsufficientBalanceException e) {
            return CommitmentCreationResult.failure(CommitmentCreationResult.VALIDATION_FAILED, e.getMessage(), false,
                    List.of(ValidationError.of("tokensToCommit", CommitmentErrorCode.INSUFFICIENT_BALANCE,
                            e.getMessage())));

        } catch (ConcurrentBalanceModificationException e) {
            log.warn("Commitment abandoned after {} conflicting attempts (userId={}, marketId={}): {}",
                    ledgerConflictRetry.getRetryConfig().getMaxAttempts(), normalized.getUserId(),
                    normalized.getPredictionId(), e.getMessage());
            return CommitmentCreationResult.failure(CommitmentCreationResult.CONCURRENT_MODIFICATION,
                    "Balance was modified concurrently, please retry", true, List.of());

        } catch (RuntimeException e) {
            log.error("Commitment creation failed (userId={}, marketId={})",
                    normalized.getUserId(), normalized.getPredictionId(), e);
            return CommitmentCreationResult.failure(CommitmentCreationResult.CREATION_FAILED,
                    "Failed to create commitment: " + e.getMessage(), false, List.of());
        }
    }

    /**
     * Legacy call shape: stake on the yes/no slot of a market.
     */
    public CommitmentCreationResult createBinaryCommitment(String userId, String marketId, Position position,
            int tokens, ClientInfo clientInfo) {
        return createCommitment(CommitmentRequest.builder()
                .userId(userId)
                .predictionId(marketId)
                .marketId(marketId)
                .position(position)
                .tokensToCommit((double) tokens)
                .clientInfo(clientInfo)
                .build());
    }

    /**
     * Stake on an explicit option.
     */
    public CommitmentCreationResult createMultiOptionCommitment(String userId, String marketId, String optionId,
            int tokens, ClientInfo clientInfo) {
        return createCommitment(CommitmentRequest.builder()
                .userId(userId)
                .predictionId(marketId)
                .marketId(marketId)
                .optionId(optionId)
                .tokensToCommit((double) tokens)
                .clientInfo(clientInfo)
                .build());
    }

    /**
     * Side-effect free validation of a request in the shape the creation path will see it.
     */
    public ValidationResult validateCommitmentRequest(CommitmentRequest request) {
        return validationService.validate(normalize(request));
    }

    private PredictionCommitment attemptCommitment(CommitmentRequest request) {
        String marketId = request.getPredictionId();
        Market market = marketId == null ? null : marketProvider.getMarket(marketId).orElse(null);

        return ledgerStore.inTransaction(session -> {
            UserBalance balance = session.getBalance(request.getUserId()).orElse(null);

            // 1. Validate against the balance this transaction will write
            ValidationResult validation = validationService.validate(request, market, balance);
            if (!validation.isValid()) {
                throw new CommitmentRejectedException(validation);
            }

            // 2. Normalize to optionId, derive the legacy position
            OptionResolution resolution = OptionResolver.resolve(market, request.getPosition(), request.getOptionId());
            MarketOption option = resolution.getOption();

            // 3. Price the stake
            int tokens = request.getTokensToCommit().intValue();
            double odds = BalanceArithmetic.calculateOptionOdds(option.getTotalTokens(), market.getTotalTokens());
            long potentialWinning = BalanceArithmetic.potentialWinnings(tokens, odds);

            // 4. Debit with a version-guarded write
            long now = clock.millis();
            UserBalance updated = BalanceArithmetic.afterCommitment(balance, tokens).toBuilder()
                    .lastUpdated(now)
                    .build();
            session.putBalance(updated, balance.getVersion());

            // 5. Commitment and ledger entry in the same transaction
            PredictionCommitment commitment = PredictionCommitment.builder()
                    .id(UUID.randomUUID().toString())
                    .userId(request.getUserId())
                    .predictionId(marketId)
                    .marketId(marketId)
                    .position(resolution.getPosition())
                    .optionId(option.getId())
                    .tokensCommitted(tokens)
                    .odds(odds)
                    .potentialWinning(potentialWinning)
                    .status(CommitmentStatus.ACTIVE)
                    .committedAt(now)
                    .metadata(buildMetadata(market, option, balance, request.getClientInfo()))
                    .build();
            session.insertCommitment(commitment);
            appendCommitTransaction(session, commitment, balance, updated, now);

            return commitment;
        });
    }

    private void appendCommitTransaction(LedgerSession session, PredictionCommitment commitment,
            UserBalance before, UserBalance after, long now) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(TokenTransaction.META_MARKET_ID, commitment.getPredictionId());
        metadata.put(TokenTransaction.META_OPTION_ID, commitment.getOptionId());
        metadata.put("position", commitment.getPosition().toValue());
        metadata.put("odds", commitment.getOdds());

        session.appendTransaction(TokenTransaction.builder()
                .id(UUID.randomUUID().toString())
                .userId(commitment.getUserId())
                .type(TransactionType.COMMIT)
                .amount(commitment.getTokensCommitted())
                .balanceBefore(before.getAvailableTokens())
                .balanceAfter(after.getAvailableTokens())
                .relatedId(commitment.getId())
                .metadata(metadata)
                .timestamp(now)
                .build());
    }

    private CommitmentMetadata buildMetadata(Market market, MarketOption option, UserBalance balance,
            ClientInfo clientInfo) {
        List<MarketOption> options = OptionResolver.effectiveOptions(market);
        return CommitmentMetadata.builder()
                .marketStatus(market.getStatus())
                .marketTitle(market.getTitle())
                .marketEndsAt(market.getEndDate())
                .oddsSnapshot(snapshot(market, options))
                .userBalanceAtCommitment(balance.getAvailableTokens())
                .source(clientInfo.getSource() == null ? CommitmentSource.WEB : clientInfo.getSource())
                .ipAddress(clientInfo.getIpAddress())
                .userAgent(clientInfo.getUserAgent())
                .selectedOptionText(option.getText())
                .marketOptionCount(options.size())
                .build();
    }

    private OddsSnapshot snapshot(Market market, List<MarketOption> options) {
        double yesTokens = options.get(0).getTotalTokens();
        double noTokens = options.size() > 1 ? options.get(1).getTotalTokens() : 0;
        int participants = market.getTotalParticipants() > 0
                ? market.getTotalParticipants()
                : options.stream().mapToInt(MarketOption::getParticipantCount).sum();

        OddsSnapshot.OddsSnapshotBuilder snapshot = OddsSnapshot.builder()
                .yesOdds(BalanceArithmetic.calculateOdds(yesTokens, noTokens, Position.YES))
                .noOdds(BalanceArithmetic.calculateOdds(yesTokens, noTokens, Position.NO))
                .totalYesTokens(yesTokens)
                .totalNoTokens(noTokens)
                .totalParticipants(participants);

        if (options.size() > 2) {
            double total = market.getTotalTokens();
            Map<String, Double> optionOdds = new LinkedHashMap<>();
            Map<String, Double> optionTokens = new LinkedHashMap<>();
            Map<String, Integer> optionParticipants = new LinkedHashMap<>();
            for (MarketOption o : options) {
                optionOdds.put(o.getId(), BalanceArithmetic.calculateOptionOdds(o.getTotalTokens(), total));
                optionTokens.put(o.getId(), o.getTotalTokens());
                optionParticipants.put(o.getId(), o.getParticipantCount());
            }
            snapshot.optionOdds(optionOdds).optionTokens(optionTokens).optionParticipants(optionParticipants);
        }
        return snapshot.build();
    }

    private static CommitmentRequest normalize(CommitmentRequest request) {
        String marketId = request.resolveMarketId();
        return request.toBuilder()
                .userId(request.getUserId() == null ? null : request.getUserId().trim())
                .predictionId(marketId)
                .marketId(marketId)
                .optionId(request.getOptionId() == null || request.getOptionId().isBlank()
                        ? null
                        : request.getOptionId().trim())
                .clientInfo(request.getClientInfo() == null ? ClientInfo.web() : request.getClientInfo())
                .build();
    }
}
