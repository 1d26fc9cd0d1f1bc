package com.prediction.market.token_ledger.service;

import static com.prediction.market.token_ledger.LedgerTestFixtures.balance;
import static com.prediction.market.token_ledger.LedgerTestFixtures.binaryMarket;
import static com.prediction.market.token_ledger.LedgerTestFixtures.fastRetry;
import static com.prediction.market.token_ledger.LedgerTestFixtures.fixedClock;
import static com.prediction.market.token_ledger.LedgerTestFixtures.properties;
import static com.prediction.market.token_ledger.LedgerTestFixtures.seed;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.prediction.market.token_ledger.dto.BalanceAuditResult;
import com.prediction.market.token_ledger.dto.BalanceFixResult;
import com.prediction.market.token_ledger.dto.BalanceHealthReport;
import com.prediction.market.token_ledger.dto.BalanceInconsistency;
import com.prediction.market.token_ledger.dto.BalanceIntegrityResult;
import com.prediction.market.token_ledger.dto.BalanceSnapshot;
import com.prediction.market.token_ledger.dto.ReconciliationReport;
import com.prediction.market.token_ledger.entity.Position;
import com.prediction.market.token_ledger.entity.PredictionCommitment;
import com.prediction.market.token_ledger.entity.UserBalance;
import com.prediction.market.token_ledger.exception.BalanceNotFoundException;
import com.prediction.market.token_ledger.store.InMemoryLedgerStore;
import com.prediction.market.token_ledger.store.InMemoryMarketProvider;
import com.prediction.market.token_ledger.store.LedgerSession;

class BalanceReconciliationServiceTest {

    private final Clock clock = fixedClock();
    private InMemoryLedgerStore store;
    private TokenLedgerService ledger;
    private CommitmentCreationService creation;
    private CommitmentSettlementService settlement;
    private BalanceReconciliationService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryLedgerStore();
        InMemoryMarketProvider markets = new InMemoryMarketProvider();
        markets.put(binaryMarket("m1", 500, 300));

        ledger = new TokenLedgerService(store, properties(), fastRetry(), clock);
        creation = new CommitmentCreationService(store, markets,
                new CommitmentValidationService(markets, store, properties(), clock), fastRetry(), clock);
        settlement = new CommitmentSettlementService(store, fastRetry(), clock);
        service = new BalanceReconciliationService(store, properties(), fastRetry(), clock);
    }

    @Test
    @DisplayName("a negative available balance is the only violation reported")
    void negativeAvailable() {
        BalanceIntegrityResult result = service.validateBalanceIntegrity(balance("u1", -10, 50, 200, 50));

        assertThat(result.isValid()).isFalse();
        assertThat(result.getViolations()).containsExactly("Available tokens cannot be negative");
    }

    @Test
    @DisplayName("undefined fields, bad versions and over-net totals are violations")
    void integrityRules() {
        UserBalance broken = balance("u1", 0, 0, 0, 0).toBuilder()
                .availableTokens(Double.NaN)
                .totalSpent(null)
                .version(0L)
                .build();
        UserBalance overNet = balance("u2", 1000, 200, 1000, 0);

        assertThat(service.validateBalanceIntegrity(broken).getViolations()).containsExactly(
                "Available tokens must be a valid number",
                "Total spent must be a valid number",
                "Version must be positive");
        assertThat(service.validateBalanceIntegrity(overNet).getViolations())
                .containsExactly("Total tokens (1200) exceed net earned tokens (1000)");
    }

    @Test
    @DisplayName("differences within the tolerance are accepted")
    void tolerance() {
        assertThat(service.validateBalanceIntegrity(balance("u1", 1000.005, 0, 1000, 0)).isValid()).isTrue();
        assertThat(service.validateBalanceIntegrity(balance("u1", 1000.02, 0, 1000, 0)).isValid()).isFalse();
    }

    @Test
    @DisplayName("integrity checks stay fast")
    void integrityPerformance() {
        UserBalance b = balance("u1", 2500, 750, 4000, 800);
        long start = System.nanoTime();
        for (int i = 0; i < 1_000; i++) {
            service.validateBalanceIntegrity(b);
        }
        long averageNanos = (System.nanoTime() - start) / 1_000;

        assertThat(averageNanos).isLessThan(10_000_000L);
    }

    @Test
    @DisplayName("reconciling an empty list reports nothing")
    void reconcileEmpty() {
        ReconciliationReport report = service.reconcileMultipleUsers(List.of());

        assertThat(report.getTotalUsersChecked()).isZero();
        assertThat(report.getUsersWithInconsistencies()).isZero();
        assertThat(report.getUsersFixed()).isZero();
        assertThat(report.getErrors()).isEmpty();
        assertThat(report.getExecutionTime()).isGreaterThanOrEqualTo(0);
    }

    @Test
    @DisplayName("balances produced by the ledger replay without drift")
    void replayMatchesLedger() {
        ledger.recordPurchase("u1", 500, 4.99, "pay_1");
        PredictionCommitment win = commit("u1", 100);
        PredictionCommitment loss = commit("u1", 50);
        PredictionCommitment refund = commit("u1", 30);
        commit("u1", 20);
        settlement.settleWin(win.getId());
        settlement.settleLoss(loss.getId());
        settlement.refundCommitment(refund.getId(), "test");

        BalanceAuditResult audit = service.auditUserBalance("u1");

        assertThat(audit.isConsistent()).isTrue();
        assertThat(audit.getIntegrityViolations()).isEmpty();
        assertThat(audit.getActiveCommitmentCount()).isEqualTo(1);
        assertThat(audit.getTransactionCount()).isEqualTo(9);
        UserBalance calculated = audit.getCalculatedBalance();
        assertThat(calculated.getAvailableTokens()).isEqualTo(1490);
        assertThat(calculated.getCommittedTokens()).isEqualTo(20);
        assertThat(calculated.getTotalEarned()).isEqualTo(1560);
    }

    @Test
    @DisplayName("a tampered balance is reported and fixed once")
    void detectAndFixDrift() {
        UserBalance created = ledger.getOrCreateBalance("u1");
        seed(store, created.toBuilder().availableTokens(5000.0).build());

        BalanceAuditResult audit = service.auditUserBalance("u1");
        assertThat(audit.isConsistent()).isFalse();
        assertThat(audit.getInconsistencies()).singleElement().satisfies(i -> {
            assertThat(i.getField()).isEqualTo("availableTokens");
            assertThat(i.getStoredValue()).isEqualTo(5000);
            assertThat(i.getCalculatedValue()).isEqualTo(1000);
            assertThat(i.getDifference()).isEqualTo(-4000);
        });

        BalanceFixResult fixed = service.fixUserBalance("u1");
        assertThat(fixed.isChanged()).isTrue();
        assertThat(fixed.getCurrent().getAvailableTokens()).isEqualTo(1000);
        assertThat(fixed.getCurrent().getVersion()).isEqualTo(3L);

        BalanceFixResult again = service.fixUserBalance("u1");
        assertThat(again.isChanged()).isFalse();
        assertThat(store.getBalance("u1").orElseThrow().getVersion()).isEqualTo(3L);
        assertThat(service.auditUserBalance("u1").isConsistent()).isTrue();
    }

    @Test
    @DisplayName("a balance whose version went missing is reported and repaired")
    void repairMissingVersion() {
        UserBalance created = ledger.getOrCreateBalance("u1");
        store.inTransaction(session -> {
            session.replaceBalance(created.toBuilder().version(null).build(), created.getVersion());
            return null;
        });

        assertThat(service.validateBalanceIntegrity(store.getBalance("u1").orElseThrow()).getViolations())
                .containsExactly("Version must be positive");
        assertThat(service.auditUserBalance("u1").getInconsistencies()).extracting(BalanceInconsistency::getField)
                .containsExactly("version");

        BalanceFixResult fixed = service.fixUserBalance("u1");

        assertThat(fixed.isChanged()).isTrue();
        UserBalance repaired = store.getBalance("u1").orElseThrow();
        assertThat(repaired.getVersion()).isEqualTo(1L);
        assertThat(repaired.getAvailableTokens()).isEqualTo(1000);
        assertThat(service.validateBalanceIntegrity(repaired).isValid()).isTrue();
        assertThat(service.fixUserBalance("u1").isChanged()).isFalse();
    }

    @Test
    @DisplayName("batch reconciliation repairs a missing version without reporting an error")
    void reconcileMissingVersion() {
        UserBalance created = ledger.getOrCreateBalance("u1");
        store.inTransaction(session -> {
            session.replaceBalance(created.toBuilder().version(null).build(), created.getVersion());
            return null;
        });

        ReconciliationReport report = service.reconcileMultipleUsers(List.of("u1"));

        assertThat(report.getErrors()).isEmpty();
        assertThat(report.getUsersFixed()).isEqualTo(1);
        assertThat(store.getBalance("u1").orElseThrow().getVersion()).isEqualTo(1L);
    }

    @Test
    @DisplayName("drift that disappears before the fix is not counted as fixed")
    void driftHealedBeforeFix() {
        AtomicReference<UserBalance> healTo = new AtomicReference<>();
        InMemoryLedgerStore racing = new InMemoryLedgerStore() {
            @Override
            public <T> T inTransaction(Function<LedgerSession, T> work) {
                UserBalance heal = healTo.getAndSet(null);
                if (heal != null) {
                    seed(this, heal);
                }
                return super.inTransaction(work);
            }
        };
        TokenLedgerService racingLedger = new TokenLedgerService(racing, properties(), fastRetry(), clock);
        UserBalance created = racingLedger.getOrCreateBalance("u1");
        seed(racing, created.toBuilder().availableTokens(5000.0).build());
        healTo.set(created);

        ReconciliationReport report = new BalanceReconciliationService(racing, properties(), fastRetry(), clock)
                .reconcileMultipleUsers(List.of("u1"));

        assertThat(report.getUsersWithInconsistencies()).isEqualTo(1);
        assertThat(report.getUsersFixed()).isZero();
        assertThat(report.getErrors()).isEmpty();
        assertThat(racing.getBalance("u1").orElseThrow().getAvailableTokens()).isEqualTo(1000);
    }

    @Test
    @DisplayName("a snapshot pairs the stored balance with the replayed one")
    void snapshot() {
        PredictionCommitment commitment = commit("u1", 100);
        UserBalance stored = store.getBalance("u1").orElseThrow();

        BalanceSnapshot snapshot = service.createBalanceSnapshot("u1");

        assertThat(snapshot.getUserId()).isEqualTo("u1");
        assertThat(snapshot.getTimestamp()).isEqualTo(clock.millis());
        assertThat(snapshot.getBalance().getAvailableTokens()).isEqualTo(stored.getAvailableTokens());
        assertThat(snapshot.getCalculatedBalance().getCommittedTokens()).isEqualTo(100);
        assertThat(snapshot.getTransactionCount()).isEqualTo(2);
        assertThat(snapshot.getCommitmentCount()).isEqualTo(1);
        assertThat(snapshot.isConsistent()).isTrue();

        settlement.settleLoss(commitment.getId());
        seed(store, store.getBalance("u1").orElseThrow().toBuilder().availableTokens(42.0).build());
        BalanceSnapshot drifted = service.createBalanceSnapshot("u1");
        assertThat(drifted.getCommitmentCount()).isZero();
        assertThat(drifted.isConsistent()).isFalse();

        assertThatThrownBy(() -> service.createBalanceSnapshot("ghost"))
                .isInstanceOf(BalanceNotFoundException.class);
    }

    @Test
    @DisplayName("fixing a user with no balance and no history fails")
    void fixMissing() {
        assertThatThrownBy(() -> service.fixUserBalance("ghost"))
                .isInstanceOf(BalanceNotFoundException.class);
    }

    @Test
    @DisplayName("blank user ids are rejected")
    void blankUserId() {
        assertThatThrownBy(() -> service.auditUserBalance(""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("User ID is required");
        assertThatThrownBy(() -> service.fixUserBalance(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("batch reconciliation fixes drifted users and collects per-user errors")
    void reconcileBatch() {
        ledger.getOrCreateBalance("clean");
        UserBalance drifted = ledger.getOrCreateBalance("drifted");
        seed(store, drifted.toBuilder().committedTokens(75.0).build());

        ReconciliationReport report = service.reconcileMultipleUsers(Arrays.asList("clean", "drifted", " "));

        assertThat(report.getTotalUsersChecked()).isEqualTo(3);
        assertThat(report.getUsersWithInconsistencies()).isEqualTo(1);
        assertThat(report.getUsersFixed()).isEqualTo(1);
        assertThat(report.getInconsistenciesFound()).extracting(BalanceInconsistency::getField)
                .containsExactly("committedTokens");
        assertThat(report.getErrors()).containsExactly("Failed to audit balance for user  : User ID is required");
        assertThat(store.getBalance("drifted").orElseThrow().getCommittedTokens()).isZero();
    }

    @Test
    @DisplayName("health report aggregates balances and samples drift without fixing")
    void healthReport() {
        ledger.getOrCreateBalance("a");
        ledger.getOrCreateBalance("b");
        commit("b", 100);
        UserBalance c = ledger.getOrCreateBalance("c");
        seed(store, c.toBuilder().availableTokens(10.0).build());

        BalanceHealthReport report = service.generateHealthReport();

        assertThat(report.getTotalUsers()).isEqualTo(3);
        assertThat(report.getUsersWithBalances()).isEqualTo(3);
        assertThat(report.getTotalTokensInCirculation()).isEqualTo(2010);
        assertThat(report.getTotalTokensCommitted()).isEqualTo(100);
        assertThat(report.getSampleSize()).isEqualTo(3);
        assertThat(report.getInconsistencyRate()).isEqualTo(1.0 / 3);
        assertThat(store.getBalance("c").orElseThrow().getAvailableTokens()).isEqualTo(10);
    }

    private PredictionCommitment commit(String userId, int tokens) {
        ledger.getOrCreateBalance(userId);
        return creation.createBinaryCommitment(userId, "m1", Position.YES, tokens, null).getCommitment();
    }
}
