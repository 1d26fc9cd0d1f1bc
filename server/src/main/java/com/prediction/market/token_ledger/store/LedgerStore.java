package com.prediction.market.token_ledger.store;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import com.prediction.market.token_ledger.entity.PredictionCommitment;
import com.prediction.market.token_ledger.entity.TokenTransaction;
import com.prediction.market.token_ledger.entity.UserBalance;

/**
 * Storage for balances, the transaction log and commitments.
 *
 * Plain reads are outside any transaction. All writes happen through {@link #inTransaction},
 * which applies the session's writes all-or-nothing and rejects balance writes whose expected
 * version no longer matches with a
 * {@link com.prediction.market.token_ledger.exception.ConcurrentBalanceModificationException}.
 */
public interface LedgerStore {

    Optional<UserBalance> getBalance(String userId);

    /**
     * Completed transactions of a user, oldest first.
     */
    List<TokenTransaction> listTransactions(String userId);

    List<PredictionCommitment> listActiveCommitments(String userId);

    List<PredictionCommitment> listActiveCommitmentsByMarket(String marketId);

    Optional<PredictionCommitment> findCommitment(String commitmentId);

    List<String> listUserIds();

    /**
     * Run {@code work} as one atomic unit. An exception thrown by {@code work} discards every
     * write made through the session.
     */
    <T> T inTransaction(Function<LedgerSession, T> work);
}
