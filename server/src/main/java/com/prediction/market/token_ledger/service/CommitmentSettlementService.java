package com.prediction.market.token_ledger.service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.prediction.market.token_ledger.dto.MarketRollbackReport;
import com.prediction.market.token_ledger.dto.RollbackEligibility;
import com.prediction.market.token_ledger.engine.BalanceArithmetic;
import com.prediction.market.token_ledger.entity.CommitmentStatus;
import com.prediction.market.token_ledger.entity.PredictionCommitment;
import com.prediction.market.token_ledger.entity.TokenTransaction;
import com.prediction.market.token_ledger.entity.TransactionType;
import com.prediction.market.token_ledger.entity.UserBalance;
import com.prediction.market.token_ledger.exception.BalanceNotFoundException;
import com.prediction.market.token_ledger.exception.CommitmentNotFoundException;
import com.prediction.market.token_ledger.store.LedgerStore;

import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Moves active commitments to a terminal state and applies the matching balance change.
 *
 * The status change, the balance write and the ledger entry share one transaction. The status
 * change is conditioned on the commitment still being ACTIVE, so a commitment is settled at
 * most once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommitmentSettlementService {

    static final long MAX_ROLLBACK_AGE_MS = Duration.ofHours(24).toMillis();

    private final LedgerStore ledgerStore;
    private final Retry ledgerConflictRetry;
    private final Clock clock;

    /**
     * Pay out a winning commitment: stake plus profit back to available.
     */
    public PredictionCommitment settleWin(String commitmentId) {
        return settle(commitmentId, CommitmentStatus.WON, null);
    }

    /**
     * Forfeit a losing commitment's stake.
     */
    public PredictionCommitment settleLoss(String commitmentId) {
        return settle(commitmentId, CommitmentStatus.LOST, null);
    }

    /**
     * Return the stake of an active commitment to the user.
     *
     * @param reason recorded on the REFUND entry
     */
    public PredictionCommitment refundCommitment(String commitmentId, String reason) {
        return settle(commitmentId, CommitmentStatus.REFUNDED, reason);
    }

    /**
     * Check whether a single commitment can still be refunded: it must be active and placed
     * within the last 24 hours.
     */
    public RollbackEligibility canRollback(String commitmentId) {
        if (commitmentId == null || commitmentId.trim().isEmpty()) {
            throw new IllegalArgumentException("Commitment ID is required");
        }
        PredictionCommitment commitment = ledgerStore.findCommitment(commitmentId).orElse(null);
        if (commitment == null) {
            return RollbackEligibility.denied("Commitment not found", null);
        }
        if (commitment.getStatus().isTerminal()) {
            return RollbackEligibility.denied(
                    "Commitment is already " + commitment.getStatus().name().toLowerCase(Locale.ROOT), commitment);
        }
        if (clock.millis() - commitment.getCommittedAt() > MAX_ROLLBACK_AGE_MS) {
            return RollbackEligibility.denied("Commitment is too old to rollback", commitment);
        }
        return RollbackEligibility.allowed(commitment);
    }

    /**
     * The user's REFUND entries, oldest first.
     */
    public List<TokenTransaction> getRollbackHistory(String userId) {
        return ledgerStore.listTransactions(TokenLedgerService.requireUserId(userId)).stream()
                .filter(tx -> tx.getType() == TransactionType.REFUND)
                .toList();
    }

    /**
     * Refund every active commitment of a market, typically after it was cancelled.
     * Failures are collected per commitment; the remaining refunds still run.
     */
    public MarketRollbackReport rollbackMarketCommitments(String marketId, String reason) {
        if (marketId == null || marketId.trim().isEmpty()) {
            throw new IllegalArgumentException("Market ID is required");
        }
        List<PredictionCommitment> active = ledgerStore.listActiveCommitmentsByMarket(marketId);

        MarketRollbackReport report = new MarketRollbackReport();
        report.setMarketId(marketId);
        report.setCommitmentsFound(active.size());

        for (PredictionCommitment commitment : active) {
            try {
                PredictionCommitment refunded = refundCommitment(commitment.getId(), reason);
                report.setRefundedCount(report.getRefundedCount() + 1);
                report.setTotalRefunded(report.getTotalRefunded() + refunded.getTokensCommitted());
            } catch (RuntimeException e) {
                log.warn("Failed to refund commitment {} of market {}: {}", commitment.getId(), marketId, e.getMessage());
                report.getFailures().add(commitment.getId() + ": " + e.getMessage());
            }
        }

        log.info("Market rollback complete: marketId={}, refunded={}/{}, tokens={}",
                marketId, report.getRefundedCount(), active.size(), report.getTotalRefunded());
        return report;
    }

    private PredictionCommitment settle(String commitmentId, CommitmentStatus target, String reason) {
        if (commitmentId == null || commitmentId.trim().isEmpty()) {
            throw new IllegalArgumentException("Commitment ID is required");
        }

        PredictionCommitment settled = Retry.decorateSupplier(ledgerConflictRetry, () -> ledgerStore.inTransaction(session -> {
            PredictionCommitment commitment = session.findCommitment(commitmentId)
                    .orElseThrow(() -> new CommitmentNotFoundException(commitmentId));
            CommitmentStatus previous = commitment.getStatus();
            long now = clock.millis();
            commitment.resolve(target, now);

            UserBalance balance = session.getBalance(commitment.getUserId())
                    .orElseThrow(() -> new BalanceNotFoundException(commitment.getUserId()));
            int stake = commitment.getTokensCommitted();
            double amount;
            UserBalance updated;
            switch (target) {
                case WON -> {
                    amount = commitment.getProfit();
                    updated = BalanceArithmetic.afterWin(balance, stake, amount);
                }
                case LOST -> {
                    amount = stake;
                    updated = BalanceArithmetic.afterLoss(balance, stake);
                }
                case REFUNDED -> {
                    amount = stake;
                    updated = BalanceArithmetic.afterRefund(balance, stake);
                }
                default -> throw new IllegalStateException("Not a settlement state: " + target);
            }
            updated = updated.toBuilder().lastUpdated(now).build();

            session.putBalance(updated, balance.getVersion());
            session.updateCommitmentStatus(commitment, previous);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(TokenTransaction.META_MARKET_ID, commitment.getPredictionId());
            metadata.put(TokenTransaction.META_OPTION_ID, commitment.getOptionId());
            metadata.put(TokenTransaction.META_TOKENS_COMMITTED, stake);
            if (reason != null) {
                metadata.put(TokenTransaction.META_REASON, reason);
            }
            session.appendTransaction(TokenTransaction.builder()
                    .id(UUID.randomUUID().toString())
                    .userId(commitment.getUserId())
                    .type(transactionType(target))
                    .amount(amount)
                    .balanceBefore(balance.getAvailableTokens())
                    .balanceAfter(updated.getAvailableTokens())
                    .relatedId(commitment.getId())
                    .metadata(metadata)
                    .timestamp(now)
                    .build());
            return commitment;
        })).get();

        log.info("Commitment settled: commitmentId={}, userId={}, status={}, tokens={}",
                settled.getId(), settled.getUserId(), settled.getStatus(), settled.getTokensCommitted());
        return settled;
    }

    private static TransactionType transactionType(CommitmentStatus status) {
        return switch (status) {
            case WON -> TransactionType.WIN;
            case LOST -> TransactionType.LOSS;
            case REFUNDED -> TransactionType.REFUND;
            default -> throw new IllegalStateException("Not a settlement state: " + status);
        };
    }
}
