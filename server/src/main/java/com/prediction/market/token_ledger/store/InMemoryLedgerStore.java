package com.prediction.market.token_ledger.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import com.prediction.market.token_ledger.entity.CommitmentStatus;
import com.prediction.market.token_ledger.entity.PredictionCommitment;
import com.prediction.market.token_ledger.entity.TokenTransaction;
import com.prediction.market.token_ledger.entity.UserBalance;
import com.prediction.market.token_ledger.exception.ConcurrentBalanceModificationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Ledger store kept in process memory.
 *
 * Transactions are optimistic: a session reads committed state, buffers its writes and
 * validates them at commit under a single mutex. A balance write commits only if the stored
 * version still equals the version the session expected; otherwise the whole session is
 * discarded with {@link ConcurrentBalanceModificationException}.
 *
 * Records are copied on the way in and out so callers never share mutable state with the store.
 */
@Slf4j
public class InMemoryLedgerStore implements LedgerStore {

    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, UserBalance> balances = new HashMap<>();
    private final Map<String, PredictionCommitment> commitments = new LinkedHashMap<>();
    private final List<TokenTransaction> transactions = new ArrayList<>();

    @Override
    public Optional<UserBalance> getBalance(String userId) {
        return locked(() -> Optional.ofNullable(balances.get(userId)).map(InMemoryLedgerStore::copy));
    }

    @Override
    public List<TokenTransaction> listTransactions(String userId) {
        return locked(() -> transactions.stream()
                .filter(t -> t.getUserId().equals(userId) && t.isCompleted())
                .sorted(Comparator.comparingLong(TokenTransaction::getTimestamp))
                .map(InMemoryLedgerStore::copy)
                .collect(Collectors.toList()));
    }

    @Override
    public List<PredictionCommitment> listActiveCommitments(String userId) {
        return locked(() -> commitments.values().stream()
                .filter(c -> c.getUserId().equals(userId) && c.isActive())
                .map(InMemoryLedgerStore::copy)
                .collect(Collectors.toList()));
    }

    @Override
    public List<PredictionCommitment> listActiveCommitmentsByMarket(String marketId) {
        return locked(() -> commitments.values().stream()
                .filter(c -> marketId.equals(c.getPredictionId()) && c.isActive())
                .map(InMemoryLedgerStore::copy)
                .collect(Collectors.toList()));
    }

    @Override
    public Optional<PredictionCommitment> findCommitment(String commitmentId) {
        return locked(() -> Optional.ofNullable(commitments.get(commitmentId)).map(InMemoryLedgerStore::copy));
    }

    @Override
    public List<String> listUserIds() {
        return locked(() -> balances.keySet().stream().sorted().collect(Collectors.toList()));
    }

    @Override
    public <T> T inTransaction(Function<LedgerSession, T> work) {
        Session session = new Session();
        T result = work.apply(session);
        session.commit();
        return result;
    }

    private <T> T locked(Supplier<T> read) {
        lock.lock();
        try {
            return read.get();
        } finally {
            lock.unlock();
        }
    }

    private static UserBalance copy(UserBalance balance) {
        return balance.toBuilder().build();
    }

    private static PredictionCommitment copy(PredictionCommitment commitment) {
        return commitment.toBuilder().build();
    }

    private static TokenTransaction copy(TokenTransaction transaction) {
        return transaction.toBuilder()
                .metadata(transaction.getMetadata() == null ? null : new HashMap<>(transaction.getMetadata()))
                .build();
    }

    /**
     * Stored state a balance write was computed against: absent, or present at a given version
     * ({@code null} for a document whose version is missing).
     */
    private static final class BalanceGuard {
        private final boolean present;
        private final Long version;

        private BalanceGuard(boolean present, Long version) {
            this.present = present;
            this.version = version;
        }

        boolean matches(UserBalance current) {
            return present ? current != null && Objects.equals(current.getVersion(), version) : current == null;
        }

        ConcurrentBalanceModificationException conflict(String userId) {
            if (present && version != null) {
                return new ConcurrentBalanceModificationException(userId, version);
            }
            return new ConcurrentBalanceModificationException(
                    "Balance for user " + userId + " was modified concurrently (expected " + this + ")", null);
        }

        @Override
        public String toString() {
            return present ? "version " + version : "absent";
        }
    }

    private final class Session implements LedgerSession {

        private final Map<String, UserBalance> pendingBalances = new LinkedHashMap<>();
        private final Map<String, BalanceGuard> guards = new HashMap<>();
        private final Map<String, PredictionCommitment> pendingCommitments = new LinkedHashMap<>();
        private final Map<String, CommitmentStatus> expectedStatuses = new HashMap<>();
        private final List<TokenTransaction> pendingTransactions = new ArrayList<>();

        @Override
        public Optional<UserBalance> getBalance(String userId) {
            if (pendingBalances.containsKey(userId)) {
                return Optional.of(copy(pendingBalances.get(userId)));
            }
            return InMemoryLedgerStore.this.getBalance(userId);
        }

        @Override
        public Optional<PredictionCommitment> findCommitment(String commitmentId) {
            if (pendingCommitments.containsKey(commitmentId)) {
                return Optional.of(copy(pendingCommitments.get(commitmentId)));
            }
            return InMemoryLedgerStore.this.findCommitment(commitmentId);
        }

        @Override
        public void putBalance(UserBalance balance, long expectedVersion) {
            // first write in the session decides the version checked at commit
            guards.putIfAbsent(balance.getUserId(),
                    expectedVersion == 0L ? new BalanceGuard(false, null) : new BalanceGuard(true, expectedVersion));
            pendingBalances.put(balance.getUserId(), copy(balance));
        }

        @Override
        public void replaceBalance(UserBalance balance, Long expectedVersion) {
            guards.putIfAbsent(balance.getUserId(), new BalanceGuard(true, expectedVersion));
            pendingBalances.put(balance.getUserId(), copy(balance));
        }

        @Override
        public void insertCommitment(PredictionCommitment commitment) {
            pendingCommitments.put(commitment.getId(), copy(commitment));
        }

        @Override
        public void updateCommitmentStatus(PredictionCommitment commitment, CommitmentStatus expectedStatus) {
            if (!pendingCommitments.containsKey(commitment.getId())) {
                expectedStatuses.put(commitment.getId(), expectedStatus);
            }
            pendingCommitments.put(commitment.getId(), copy(commitment));
        }

        @Override
        public void appendTransaction(TokenTransaction transaction) {
            pendingTransactions.add(copy(transaction));
        }

        void commit() {
            lock.lock();
            try {
                for (Map.Entry<String, BalanceGuard> guard : guards.entrySet()) {
                    UserBalance current = balances.get(guard.getKey());
                    if (!guard.getValue().matches(current)) {
                        log.debug("Version conflict for user {}: expected {}, stored {}", guard.getKey(),
                                guard.getValue(), current == null ? "absent" : "version " + current.getVersion());
                        throw guard.getValue().conflict(guard.getKey());
                    }
                }
                for (Map.Entry<String, PredictionCommitment> pending : pendingCommitments.entrySet()) {
                    PredictionCommitment current = commitments.get(pending.getKey());
                    CommitmentStatus expectedStatus = expectedStatuses.get(pending.getKey());
                    boolean insert = expectedStatus == null;
                    if (insert ? current != null : current == null || current.getStatus() != expectedStatus) {
                        throw new ConcurrentBalanceModificationException(
                                "Commitment " + pending.getKey() + " was modified concurrently", null);
                    }
                }
                balances.putAll(pendingBalances);
                commitments.putAll(pendingCommitments);
                transactions.addAll(pendingTransactions);
            } finally {
                lock.unlock();
            }
        }
    }
}
