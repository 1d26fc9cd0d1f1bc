package com.prediction.market.token_ledger.engine;

import com.prediction.market.token_ledger.entity.Position;
import com.prediction.market.token_ledger.entity.UserBalance;
import com.prediction.market.token_ledger.exception.InsufficientBalanceException;

/**
 * Pure balance transitions used by the commitment path, settlement and reconciliation.
 *
 * Every transition returns a new {@link UserBalance} with {@code version} incremented by
 * exactly one and leaves the input untouched. No I/O, no clock: {@code lastUpdated} is the
 * caller's concern.
 */
public final class BalanceArithmetic {

    private BalanceArithmetic() {
    }

    /**
     * Lock tokens for a new commitment.
     *
     * @throws InsufficientBalanceException if available tokens are below {@code tokensToCommit}
     */
    public static UserBalance afterCommitment(UserBalance balance, double tokensToCommit) {
        double available = available(balance);
        if (available < tokensToCommit) {
            throw new InsufficientBalanceException(available, tokensToCommit);
        }
        return next(balance)
                .availableTokens(available - tokensToCommit)
                .committedTokens(committed(balance) + tokensToCommit)
                .build();
    }

    /**
     * Purchase in which {@code amountSpentUsd} is recorded against lifetime spending.
     */
    public static UserBalance afterPurchase(UserBalance balance, double tokensPurchased, double amountSpentUsd) {
        return next(balance)
                .availableTokens(available(balance) + tokensPurchased)
                .totalSpent(spent(balance) + amountSpentUsd)
                .build();
    }

    /**
     * Token inflow counted as earned: signup bonus, credited purchase, admin grant.
     */
    public static UserBalance afterCredit(UserBalance balance, double tokens) {
        return next(balance)
                .availableTokens(available(balance) + tokens)
                .totalEarned(earned(balance) + tokens)
                .build();
    }

    /**
     * Return the stake plus winnings and release the stake from committed.
     *
     * @param tokensWon profit on top of the returned stake
     */
    public static UserBalance afterWin(UserBalance balance, double tokensCommitted, double tokensWon) {
        return next(balance)
                .availableTokens(available(balance) + tokensCommitted + tokensWon)
                .committedTokens(committed(balance) - tokensCommitted)
                .totalEarned(earned(balance) + tokensWon)
                .build();
    }

    /**
     * Forfeit the stake. Nothing returns to available.
     */
    public static UserBalance afterLoss(UserBalance balance, double tokensCommitted) {
        return next(balance)
                .committedTokens(committed(balance) - tokensCommitted)
                .build();
    }

    public static UserBalance afterRefund(UserBalance balance, double tokensToRefund) {
        return next(balance)
                .availableTokens(available(balance) + tokensToRefund)
                .committedTokens(committed(balance) - tokensToRefund)
                .build();
    }

    public static double totalBalance(UserBalance balance) {
        return available(balance) + committed(balance);
    }

    public static double netProfitLoss(UserBalance balance) {
        return earned(balance) - spent(balance);
    }

    /**
     * Payout multiplier for the caller's side of a two-sided pool.
     * Degenerate pools (empty, or nothing on the caller's side) price at 1.0.
     */
    public static double calculateOdds(double totalYes, double totalNo, Position position) {
        double pool = totalYes + totalNo;
        double ownSide = position == Position.YES ? totalYes : totalNo;
        if (pool <= 0 || ownSide <= 0) {
            return 1.0;
        }
        return Math.max(1.0, pool / ownSide);
    }

    /**
     * Odds of one option against the rest of a multi-option pool.
     */
    public static double calculateOptionOdds(double optionTokens, double marketTotalTokens) {
        return calculateOdds(optionTokens, marketTotalTokens - optionTokens, Position.YES);
    }

    public static long potentialWinnings(double tokensCommitted, double odds) {
        return Math.round(tokensCommitted * odds);
    }

    private static UserBalance.UserBalanceBuilder next(UserBalance balance) {
        return balance.toBuilder().version(version(balance) + 1);
    }

    private static double available(UserBalance balance) {
        return require(balance.getAvailableTokens(), "availableTokens", balance);
    }

    private static double committed(UserBalance balance) {
        return require(balance.getCommittedTokens(), "committedTokens", balance);
    }

    private static double earned(UserBalance balance) {
        return require(balance.getTotalEarned(), "totalEarned", balance);
    }

    private static double spent(UserBalance balance) {
        return require(balance.getTotalSpent(), "totalSpent", balance);
    }

    private static long version(UserBalance balance) {
        if (balance.getVersion() == null) {
            throw new IllegalStateException("Balance version is undefined for user " + balance.getUserId());
        }
        return balance.getVersion();
    }

    private static double require(Double value, String field, UserBalance balance) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            throw new IllegalStateException(
                    String.format("Balance field %s is not a valid number for user %s", field, balance.getUserId()));
        }
        return value;
    }
}
