package com.prediction.market.token_ledger.store;

import java.util.Optional;

import com.prediction.market.token_ledger.entity.CommitmentStatus;
import com.prediction.market.token_ledger.entity.PredictionCommitment;
import com.prediction.market.token_ledger.entity.TokenTransaction;
import com.prediction.market.token_ledger.entity.UserBalance;

/**
 * Read/write view handed to a {@link LedgerStore#inTransaction} callback.
 */
public interface LedgerSession {

    Optional<UserBalance> getBalance(String userId);

    Optional<PredictionCommitment> findCommitment(String commitmentId);

    /**
     * Write {@code balance} only if the stored version equals {@code expectedVersion}.
     * An expected version of 0 means the balance must not exist yet.
     */
    void putBalance(UserBalance balance, long expectedVersion);

    /**
     * Overwrite an existing balance whose stored version equals {@code expectedVersion}, which may
     * be {@code null} for a document with a missing version. Used to repair corrupted balances.
     */
    void replaceBalance(UserBalance balance, Long expectedVersion);

    void insertCommitment(PredictionCommitment commitment);

    /**
     * Persist the new status and resolvedAt of {@code commitment} if its stored status is still
     * {@code expectedStatus}.
     */
    void updateCommitmentStatus(PredictionCommitment commitment, CommitmentStatus expectedStatus);

    void appendTransaction(TokenTransaction transaction);
}
