package com.prediction.market.token_ledger.service;

import static com.prediction.market.token_ledger.LedgerTestFixtures.NOW;
import static com.prediction.market.token_ledger.LedgerTestFixtures.balance;
import static com.prediction.market.token_ledger.LedgerTestFixtures.binaryMarket;
import static com.prediction.market.token_ledger.LedgerTestFixtures.fastRetry;
import static com.prediction.market.token_ledger.LedgerTestFixtures.fixedClock;
import static com.prediction.market.token_ledger.LedgerTestFixtures.multiOptionMarket;
import static com.prediction.market.token_ledger.LedgerTestFixtures.option;
import static com.prediction.market.token_ledger.LedgerTestFixtures.properties;
import static com.prediction.market.token_ledger.LedgerTestFixtures.seed;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.prediction.market.token_ledger.dto.ClientInfo;
import com.prediction.market.token_ledger.dto.CommitmentCreationResult;
import com.prediction.market.token_ledger.dto.CommitmentRequest;
import com.prediction.market.token_ledger.entity.CommitmentSource;
import com.prediction.market.token_ledger.entity.Position;
import com.prediction.market.token_ledger.entity.PredictionCommitment;
import com.prediction.market.token_ledger.entity.TokenTransaction;
import com.prediction.market.token_ledger.entity.TransactionType;
import com.prediction.market.token_ledger.entity.UserBalance;
import com.prediction.market.token_ledger.store.InMemoryLedgerStore;
import com.prediction.market.token_ledger.store.InMemoryMarketProvider;
import com.prediction.market.token_ledger.store.LedgerSession;
import com.prediction.market.token_ledger.store.LedgerStore;
import com.prediction.market.token_ledger.validation.CommitmentErrorCode;
import com.prediction.market.token_ledger.validation.ValidationError;

class CommitmentCreationServiceTest {

    private final Clock clock = fixedClock();
    private InMemoryMarketProvider markets;

    @BeforeEach
    void setUp() {
        markets = new InMemoryMarketProvider();
        markets.put(binaryMarket("m1", 500, 300));
    }

    @Test
    @DisplayName("yes on a 500/300 binary market derives the yes option, odds 1.6 and potential 160")
    void binaryCommitmentPricing() {
        InMemoryLedgerStore store = new InMemoryLedgerStore();
        seed(store, balance("u1", 1000, 0, 1000, 0));

        CommitmentCreationResult result = service(store).createCommitment(request("u1", 100.0).position(Position.YES).build());

        assertThat(result.isSuccess()).isTrue();
        PredictionCommitment commitment = result.getCommitment();
        assertThat(result.getCommitmentId()).isEqualTo(commitment.getId());
        assertThat(commitment.getOptionId()).isEqualTo("yes");
        assertThat(commitment.getPosition()).isEqualTo(Position.YES);
        assertThat(commitment.getOdds()).isCloseTo(1.6, within(1e-9));
        assertThat(commitment.getPotentialWinning()).isEqualTo(160L);
        assertThat(commitment.getCommittedAt()).isEqualTo(NOW.toEpochMilli());
        assertThat(commitment.getMetadata().getUserBalanceAtCommitment()).isEqualTo(1000);
        assertThat(commitment.getMetadata().getSource()).isEqualTo(CommitmentSource.WEB);
        assertThat(commitment.getMetadata().getOddsSnapshot().getOptionOdds()).isNull();
    }

    @Test
    @DisplayName("balance, commitment and COMMIT entry are written together")
    void writesAllRecords() {
        InMemoryLedgerStore store = new InMemoryLedgerStore();
        seed(store, balance("u1", 1000, 0, 1000, 0));

        PredictionCommitment commitment = service(store)
                .createCommitment(request("u1", 250.0).optionId("no").build())
                .getCommitment();

        UserBalance after = store.getBalance("u1").orElseThrow();
        assertThat(after.getAvailableTokens()).isEqualTo(750);
        assertThat(after.getCommittedTokens()).isEqualTo(250);
        assertThat(after.getVersion()).isEqualTo(2L);
        assertThat(after.getLastUpdated()).isEqualTo(NOW.toEpochMilli());

        assertThat(store.findCommitment(commitment.getId())).isPresent();
        List<TokenTransaction> transactions = store.listTransactions("u1");
        assertThat(transactions).hasSize(1);
        TokenTransaction tx = transactions.get(0);
        assertThat(tx.getType()).isEqualTo(TransactionType.COMMIT);
        assertThat(tx.getAmount()).isEqualTo(250);
        assertThat(tx.getBalanceBefore()).isEqualTo(1000);
        assertThat(tx.getBalanceAfter()).isEqualTo(750);
        assertThat(tx.getRelatedId()).isEqualTo(commitment.getId());
        assertThat(tx.getMetadata()).containsEntry(TokenTransaction.META_OPTION_ID, "no");
    }

    @Test
    @DisplayName("a rejected request writes nothing")
    void rejectedRequestWritesNothing() {
        InMemoryLedgerStore store = new InMemoryLedgerStore();
        seed(store, balance("u1", 50, 0, 50, 0));

        CommitmentCreationResult result = service(store).createCommitment(request("u1", 100.0).position(Position.YES).build());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError().getCode()).isEqualTo(CommitmentCreationResult.VALIDATION_FAILED);
        assertThat(result.getError().isRetryable()).isFalse();
        assertThat(result.getError().getErrors()).extracting(ValidationError::getCode)
                .containsExactly(CommitmentErrorCode.INSUFFICIENT_BALANCE.name());
        assertThat(store.getBalance("u1").orElseThrow().getVersion()).isEqualTo(1L);
        assertThat(store.listActiveCommitments("u1")).isEmpty();
        assertThat(store.listTransactions("u1")).isEmpty();
    }

    @Test
    @DisplayName("multi-option commitment prices against the whole pool and snapshots every option")
    void multiOptionCommitment() {
        InMemoryLedgerStore store = new InMemoryLedgerStore();
        seed(store, balance("u1", 1000, 0, 1000, 0));
        markets.put(multiOptionMarket("m2",
                option("a", "Drake", 200), option("b", "Kendrick", 300), option("c", "Future", 500)));

        CommitmentCreationResult result = service(store).createMultiOptionCommitment("u1", "m2", "a", 100,
                new ClientInfo(CommitmentSource.MOBILE, "10.0.0.1", "ios"));

        PredictionCommitment commitment = result.getCommitment();
        assertThat(commitment.getOdds()).isCloseTo(5.0, within(1e-9));
        assertThat(commitment.getPotentialWinning()).isEqualTo(500L);
        assertThat(commitment.getPosition()).isEqualTo(Position.YES);
        assertThat(commitment.getMetadata().getSelectedOptionText()).isEqualTo("Drake");
        assertThat(commitment.getMetadata().getMarketOptionCount()).isEqualTo(3);
        assertThat(commitment.getMetadata().getSource()).isEqualTo(CommitmentSource.MOBILE);
        assertThat(commitment.getMetadata().getOddsSnapshot().getOptionTokens())
                .containsEntry("a", 200.0).containsEntry("b", 300.0).containsEntry("c", 500.0);
    }

    @Test
    @DisplayName("position-only request on a multi-option market without a keyword match is rejected")
    void ambiguousPositionRejected() {
        InMemoryLedgerStore store = new InMemoryLedgerStore();
        seed(store, balance("u1", 1000, 0, 1000, 0));
        markets.put(multiOptionMarket("m2",
                option("a", "Drake", 200), option("b", "Kendrick", 300), option("c", "Future", 500)));

        CommitmentCreationResult result = service(store).createBinaryCommitment("u1", "m2", Position.YES, 10, null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError().getMessage())
                .isEqualTo("Option ID is required for markets with more than two options");
    }

    @Test
    @DisplayName("a version conflict is retried and the retry succeeds")
    void retriesConflict() {
        ConflictingStore store = new ConflictingStore(1);
        seed(store, balance("u1", 1000, 0, 1000, 0));

        CommitmentCreationResult result = service(store).createCommitment(request("u1", 100.0).position(Position.YES).build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(store.attempts.get()).isEqualTo(2);
        UserBalance after = store.getBalance("u1").orElseThrow();
        assertThat(after.getAvailableTokens()).isEqualTo(900);
        assertThat(store.listActiveCommitments("u1")).hasSize(1);
        assertThat(store.listTransactions("u1")).hasSize(1);
    }

    @Test
    @DisplayName("exhausted retries return a retryable concurrent-modification failure")
    void retriesExhausted() {
        ConflictingStore store = new ConflictingStore(Integer.MAX_VALUE);
        seed(store, balance("u1", 1000, 0, 1000, 0));

        CommitmentCreationResult result = service(store).createCommitment(request("u1", 100.0).position(Position.YES).build());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError().getCode()).isEqualTo(CommitmentCreationResult.CONCURRENT_MODIFICATION);
        assertThat(result.getError().isRetryable()).isTrue();
        assertThat(store.attempts.get()).isEqualTo(3);
        assertThat(store.getBalance("u1").orElseThrow().getAvailableTokens()).isEqualTo(1000);
        assertThat(store.listActiveCommitments("u1")).isEmpty();
    }

    @Test
    @DisplayName("two concurrent commitments that jointly exceed the balance: exactly one succeeds")
    void concurrentCommitments() throws Exception {
        InMemoryLedgerStore store = new InMemoryLedgerStore();
        seed(store, balance("u1", 150, 0, 150, 0));
        CommitmentCreationService service = service(store);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<CommitmentCreationResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 2; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return service.createCommitment(request("u1", 100.0).position(Position.YES).build());
                }));
            }
            start.countDown();

            int successes = 0;
            for (Future<CommitmentCreationResult> future : futures) {
                CommitmentCreationResult result = future.get(5, TimeUnit.SECONDS);
                if (result.isSuccess()) {
                    successes++;
                } else {
                    assertThat(result.getError().getCode()).isIn(
                            CommitmentCreationResult.VALIDATION_FAILED, CommitmentCreationResult.CONCURRENT_MODIFICATION);
                }
            }
            assertThat(successes).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }

        UserBalance after = store.getBalance("u1").orElseThrow();
        assertThat(after.getAvailableTokens()).isEqualTo(50);
        assertThat(after.getCommittedTokens()).isEqualTo(100);
        assertThat(store.listActiveCommitments("u1")).hasSize(1);
    }

    private CommitmentCreationService service(LedgerStore store) {
        CommitmentValidationService validation = new CommitmentValidationService(markets, store, properties(), clock);
        return new CommitmentCreationService(store, markets, validation, fastRetry(), clock);
    }

    private static CommitmentRequest.CommitmentRequestBuilder request(String userId, Double tokens) {
        return CommitmentRequest.builder()
                .userId(userId)
                .predictionId("m1")
                .tokensToCommit(tokens);
    }

    /**
     * Commits a competing balance write during the first {@code conflicts} transactions.
     */
    private static final class ConflictingStore extends InMemoryLedgerStore {

        private final AtomicInteger attempts = new AtomicInteger();
        private final int conflicts;

        ConflictingStore(int conflicts) {
            this.conflicts = conflicts;
        }

        @Override
        public <T> T inTransaction(Function<LedgerSession, T> work) {
            return super.inTransaction(session -> {
                T result = work.apply(session);
                if (result instanceof PredictionCommitment && attempts.incrementAndGet() <= conflicts) {
                    super.inTransaction(competing -> {
                        UserBalance current = competing.getBalance("u1").orElseThrow();
                        competing.putBalance(current.toBuilder().version(current.getVersion() + 1).build(),
                                current.getVersion());
                        return null;
                    });
                }
                return result;
            });
        }
    }
}
