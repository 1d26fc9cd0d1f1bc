package com.prediction.market.token_ledger.store;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.mongodb.UncategorizedMongoDbException;
import org.springframework.transaction.support.TransactionTemplate;

import com.mongodb.MongoException;
import com.prediction.market.token_ledger.entity.CommitmentStatus;
import com.prediction.market.token_ledger.entity.PredictionCommitment;
import com.prediction.market.token_ledger.entity.TokenTransaction;
import com.prediction.market.token_ledger.entity.TransactionStatus;
import com.prediction.market.token_ledger.entity.UserBalance;
import com.prediction.market.token_ledger.exception.ConcurrentBalanceModificationException;
import com.prediction.market.token_ledger.repositories.PredictionCommitmentRepository;
import com.prediction.market.token_ledger.repositories.TokenTransactionRepository;
import com.prediction.market.token_ledger.repositories.UserBalanceRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Ledger store on MongoDB.
 *
 * {@link #inTransaction} runs inside a multi-document transaction (requires a replica set).
 * Balance writes are conditioned on the stored version through
 * {@link UserBalanceRepository#compareAndSetBalance}; commitment status changes through
 * {@link PredictionCommitmentRepository#atomicStatusTransition}. A zero modified count, a
 * duplicate insert or a server-side write conflict all surface as
 * {@link ConcurrentBalanceModificationException}.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoLedgerStore implements LedgerStore {

    private final UserBalanceRepository balanceRepository;
    private final TokenTransactionRepository transactionRepository;
    private final PredictionCommitmentRepository commitmentRepository;
    private final TransactionTemplate transactionTemplate;

    @Override
    public Optional<UserBalance> getBalance(String userId) {
        return balanceRepository.findById(userId);
    }

    @Override
    public List<TokenTransaction> listTransactions(String userId) {
        return transactionRepository.findByUserIdAndStatusOrderByTimestampAsc(userId, TransactionStatus.COMPLETED);
    }

    @Override
    public List<PredictionCommitment> listActiveCommitments(String userId) {
        return commitmentRepository.findByUserIdAndStatus(userId, CommitmentStatus.ACTIVE);
    }

    @Override
    public List<PredictionCommitment> listActiveCommitmentsByMarket(String marketId) {
        return commitmentRepository.findByPredictionIdAndStatus(marketId, CommitmentStatus.ACTIVE);
    }

    @Override
    public Optional<PredictionCommitment> findCommitment(String commitmentId) {
        return commitmentRepository.findById(commitmentId);
    }

    @Override
    public List<String> listUserIds() {
        return balanceRepository.findAll().stream()
                .map(UserBalance::getUserId)
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public <T> T inTransaction(Function<LedgerSession, T> work) {
        try {
            return transactionTemplate.execute(status -> work.apply(new MongoSession()));
        } catch (TransientDataAccessException e) {
            throw new ConcurrentBalanceModificationException("Ledger transaction conflicted: " + e.getMessage(), e);
        } catch (UncategorizedMongoDbException e) {
            if (e.getCause() instanceof MongoException
                    && ((MongoException) e.getCause()).hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL)) {
                throw new ConcurrentBalanceModificationException("Ledger transaction conflicted: " + e.getMessage(), e);
            }
            throw e;
        }
    }

    private final class MongoSession implements LedgerSession {

        @Override
        public Optional<UserBalance> getBalance(String userId) {
            return balanceRepository.findById(userId);
        }

        @Override
        public Optional<PredictionCommitment> findCommitment(String commitmentId) {
            return commitmentRepository.findById(commitmentId);
        }

        @Override
        public void putBalance(UserBalance balance, long expectedVersion) {
            if (expectedVersion == 0L) {
                try {
                    balanceRepository.insert(balance);
                } catch (DuplicateKeyException e) {
                    throw new ConcurrentBalanceModificationException(balance.getUserId(), expectedVersion);
                }
                return;
            }
            compareAndSet(balance, expectedVersion);
        }

        @Override
        public void replaceBalance(UserBalance balance, Long expectedVersion) {
            compareAndSet(balance, expectedVersion);
        }

        private void compareAndSet(UserBalance balance, Long expectedVersion) {
            long modified = balanceRepository.compareAndSetBalance(
                    balance.getUserId(),
                    expectedVersion,
                    balance.getAvailableTokens(),
                    balance.getCommittedTokens(),
                    balance.getTotalEarned(),
                    balance.getTotalSpent(),
                    balance.getVersion(),
                    balance.getLastUpdated());
            if (modified == 0) {
                log.debug("Version guard rejected write for user {} (expected version {})",
                        balance.getUserId(), expectedVersion);
                if (expectedVersion == null) {
                    throw new ConcurrentBalanceModificationException(
                            "Balance of user " + balance.getUserId() + " no longer has a missing version", null);
                }
                throw new ConcurrentBalanceModificationException(balance.getUserId(), expectedVersion);
            }
        }

        @Override
        public void insertCommitment(PredictionCommitment commitment) {
            try {
                commitmentRepository.insert(commitment);
            } catch (DuplicateKeyException e) {
                throw new ConcurrentBalanceModificationException(
                        "Commitment " + commitment.getId() + " already exists", e);
            }
        }

        @Override
        public void updateCommitmentStatus(PredictionCommitment commitment, CommitmentStatus expectedStatus) {
            long modified = commitmentRepository.atomicStatusTransition(
                    commitment.getId(),
                    expectedStatus.name(),
                    commitment.getStatus().name(),
                    commitment.getResolvedAt());
            if (modified == 0) {
                throw new ConcurrentBalanceModificationException(
                        "Commitment " + commitment.getId() + " is no longer " + expectedStatus, null);
            }
        }

        @Override
        public void appendTransaction(TokenTransaction transaction) {
            transactionRepository.insert(transaction);
        }
    }
}
