package com.prediction.market.token_ledger.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.prediction.market.token_ledger.config.LedgerProperties;
import com.prediction.market.token_ledger.dto.BalanceAuditResult;
import com.prediction.market.token_ledger.dto.BalanceFixResult;
import com.prediction.market.token_ledger.dto.BalanceHealthReport;
import com.prediction.market.token_ledger.dto.BalanceInconsistency;
import com.prediction.market.token_ledger.dto.BalanceIntegrityResult;
import com.prediction.market.token_ledger.dto.BalanceSnapshot;
import com.prediction.market.token_ledger.dto.ReconciliationReport;
import com.prediction.market.token_ledger.engine.BalanceArithmetic;
import com.prediction.market.token_ledger.entity.PredictionCommitment;
import com.prediction.market.token_ledger.entity.TokenTransaction;
import com.prediction.market.token_ledger.entity.UserBalance;
import com.prediction.market.token_ledger.exception.BalanceNotFoundException;
import com.prediction.market.token_ledger.store.LedgerStore;

import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Audit and repair of stored balances.
 *
 * The transaction log is the SOURCE OF TRUTH. A user's expected balance is rebuilt by replaying
 * completed transactions through {@link BalanceArithmetic}, the same transitions the live path
 * applies, with committed tokens taken from the user's active commitments. Drift is reported by
 * {@link #auditUserBalance} and only corrected by an explicit {@link #fixUserBalance} call, which
 * writes through the same version-guarded path as every other mutation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BalanceReconciliationService {

    static final int HEALTH_SAMPLE_SIZE = 50;

    private final LedgerStore ledgerStore;
    private final LedgerProperties properties;
    private final Retry ledgerConflictRetry;
    private final Clock clock;

    /**
     * Check a balance against its own invariants. Pure; no I/O.
     *
     * @param balance the balance to check
     * @return every violated rule, in a fixed order
     */
    public BalanceIntegrityResult validateBalanceIntegrity(UserBalance balance) {
        List<String> violations = new ArrayList<>();

        Double available = balance.getAvailableTokens();
        Double committed = balance.getCommittedTokens();
        Double earned = balance.getTotalEarned();
        Double spent = balance.getTotalSpent();

        checkNonNegative(available, "Available tokens", violations);
        checkNonNegative(committed, "Committed tokens", violations);
        checkNonNegative(earned, "Total earned", violations);
        checkNonNegative(spent, "Total spent", violations);

        if (balance.getVersion() == null || balance.getVersion() <= 0) {
            violations.add("Version must be positive");
        }

        if (isNumber(available) && isNumber(committed) && isNumber(earned) && isNumber(spent)) {
            double totalTokens = available + committed;
            double netTokens = earned - spent;
            if (totalTokens > netTokens + properties.getReconciliation().getTolerance()) {
                violations.add(String.format("Total tokens (%s) exceed net earned tokens (%s)",
                        plain(totalTokens), plain(netTokens)));
            }
        }

        return new BalanceIntegrityResult(violations);
    }

    /**
     * Rebuild the user's balance from history and diff it against the stored one.
     *
     * @param userId the user to audit
     * @return stored and recomputed balances with every field that differs beyond tolerance
     * @throws IllegalArgumentException if the user ID is empty
     */
    public BalanceAuditResult auditUserBalance(String userId) {
        String id = TokenLedgerService.requireUserId(userId);

        UserBalance stored = ledgerStore.getBalance(id).orElse(null);
        List<TokenTransaction> transactions = ledgerStore.listTransactions(id);
        List<PredictionCommitment> activeCommitments = ledgerStore.listActiveCommitments(id);

        UserBalance calculated = calculateBalance(id, transactions, activeCommitments);
        List<BalanceInconsistency> inconsistencies = detectInconsistencies(id, stored, calculated);
        List<String> integrityViolations = stored == null
                ? List.of()
                : validateBalanceIntegrity(stored).getViolations();

        if (!inconsistencies.isEmpty()) {
            log.warn("Balance drift detected for user {}: {}", id, inconsistencies);
        }

        return BalanceAuditResult.builder()
                .userId(id)
                .storedBalance(stored)
                .calculatedBalance(calculated)
                .inconsistencies(inconsistencies)
                .integrityViolations(integrityViolations)
                .transactionCount(transactions.size())
                .activeCommitmentCount(activeCommitments.size())
                .auditedAt(clock.millis())
                .build();
    }

    /**
     * Point-in-time copy of the stored balance next to the one rebuilt from history.
     *
     * @throws BalanceNotFoundException if the user has no stored balance
     */
    public BalanceSnapshot createBalanceSnapshot(String userId) {
        BalanceAuditResult audit = auditUserBalance(userId);
        if (audit.getStoredBalance() == null) {
            throw new BalanceNotFoundException(audit.getUserId());
        }
        return BalanceSnapshot.builder()
                .userId(audit.getUserId())
                .timestamp(audit.getAuditedAt())
                .balance(audit.getStoredBalance())
                .transactionCount(audit.getTransactionCount())
                .commitmentCount(audit.getActiveCommitmentCount())
                .calculatedBalance(audit.getCalculatedBalance())
                .consistent(audit.isConsistent())
                .build();
    }

    /**
     * Overwrite the stored balance with the recomputed one. A balance without drift is left
     * untouched, so repeated calls are idempotent.
     *
     * @param userId the user to repair
     * @return the balance before and after
     * @throws IllegalArgumentException if the user ID is empty
     * @throws BalanceNotFoundException if there is neither a stored balance nor anything to restore
     */
    public BalanceFixResult fixUserBalance(String userId) {
        String id = TokenLedgerService.requireUserId(userId);

        BalanceFixResult result = Retry.decorateSupplier(ledgerConflictRetry, () -> ledgerStore.inTransaction(session -> {
            UserBalance stored = session.getBalance(id).orElse(null);
            UserBalance calculated = calculateBalance(id, ledgerStore.listTransactions(id),
                    ledgerStore.listActiveCommitments(id));
            List<BalanceInconsistency> inconsistencies = detectInconsistencies(id, stored, calculated);

            if (inconsistencies.isEmpty()) {
                if (stored == null) {
                    throw new BalanceNotFoundException(id);
                }
                return new BalanceFixResult(id, false, stored, stored);
            }

            UserBalance corrected = calculated.toBuilder()
                    .version(hasValidVersion(stored) ? stored.getVersion() + 1 : 1L)
                    .lastUpdated(clock.millis())
                    .build();
            if (stored == null) {
                session.putBalance(corrected, 0L);
            } else {
                // guarded on whatever version is stored, including a missing one
                session.replaceBalance(corrected, stored.getVersion());
            }
            return new BalanceFixResult(id, true, stored, corrected);
        })).get();

        if (result.isChanged()) {
            log.info("Balance fixed for user {}: available {} -> {}, committed {} -> {}, version {}",
                    id,
                    result.getPrevious() == null ? null : result.getPrevious().getAvailableTokens(),
                    result.getCurrent().getAvailableTokens(),
                    result.getPrevious() == null ? null : result.getPrevious().getCommittedTokens(),
                    result.getCurrent().getCommittedTokens(),
                    result.getCurrent().getVersion());
        }
        return result;
    }

    /**
     * Audit each user and fix the ones that drifted. Per-user failures are collected, not thrown.
     */
    public ReconciliationReport reconcileMultipleUsers(List<String> userIds) {
        long start = System.currentTimeMillis();
        ReconciliationReport report = new ReconciliationReport();

        if (userIds == null || userIds.isEmpty()) {
            report.setExecutionTime(System.currentTimeMillis() - start);
            return report;
        }

        for (String userId : userIds) {
            report.setTotalUsersChecked(report.getTotalUsersChecked() + 1);
            BalanceAuditResult audit;
            try {
                audit = auditUserBalance(userId);
            } catch (RuntimeException e) {
                report.getErrors().add(String.format("Failed to audit balance for user %s: %s", userId, e.getMessage()));
                continue;
            }
            if (audit.isConsistent()) {
                continue;
            }
            report.setUsersWithInconsistencies(report.getUsersWithInconsistencies() + 1);
            report.getInconsistenciesFound().addAll(audit.getInconsistencies());
            try {
                if (fixUserBalance(userId).isChanged()) {
                    report.setUsersFixed(report.getUsersFixed() + 1);
                }
            } catch (RuntimeException e) {
                report.getErrors().add(String.format("Failed to fix balance for user %s: %s", userId, e.getMessage()));
            }
        }

        report.setExecutionTime(System.currentTimeMillis() - start);
        log.info("Balance reconciliation complete: {} users checked, {} inconsistent, {} fixed, {} errors",
                report.getTotalUsersChecked(), report.getUsersWithInconsistencies(), report.getUsersFixed(),
                report.getErrors().size());
        return report;
    }

    public ReconciliationReport reconcileAllUsers() {
        return reconcileMultipleUsers(ledgerStore.listUserIds());
    }

    /**
     * Aggregate figures over all balances plus the drift rate of an audited sample.
     * Audits only; never fixes.
     */
    public BalanceHealthReport generateHealthReport() {
        List<String> userIds = ledgerStore.listUserIds();

        int usersWithBalances = 0;
        double circulation = 0;
        double committed = 0;
        for (String userId : userIds) {
            UserBalance balance = ledgerStore.getBalance(userId).orElse(null);
            if (balance == null || !isNumber(balance.getAvailableTokens()) || !isNumber(balance.getCommittedTokens())) {
                continue;
            }
            if (balance.getAvailableTokens() > 0 || balance.getCommittedTokens() > 0) {
                usersWithBalances++;
            }
            circulation += BalanceArithmetic.totalBalance(balance);
            committed += balance.getCommittedTokens();
        }

        List<String> sample = userIds.subList(0, Math.min(HEALTH_SAMPLE_SIZE, userIds.size()));
        int drifted = 0;
        for (String userId : sample) {
            try {
                if (!auditUserBalance(userId).isConsistent()) {
                    drifted++;
                }
            } catch (RuntimeException e) {
                log.warn("Health audit failed for user {}: {}", userId, e.getMessage());
                drifted++;
            }
        }

        return BalanceHealthReport.builder()
                .totalUsers(userIds.size())
                .usersWithBalances(usersWithBalances)
                .totalTokensInCirculation(circulation)
                .totalTokensCommitted(committed)
                .averageBalancePerUser(userIds.isEmpty() ? 0 : circulation / userIds.size())
                .inconsistencyRate(sample.isEmpty() ? 0 : (double) drifted / sample.size())
                .sampleSize(sample.size())
                .generatedAt(clock.millis())
                .build();
    }

    /**
     * Periodic sweep that logs drift. Corrections stay a separate, explicit call.
     */
    @Scheduled(fixedDelayString = "${ledger.reconciliation.audit-interval-ms:300000}",
            initialDelayString = "${ledger.reconciliation.audit-interval-ms:300000}")
    public void auditAllBalances() {
        if (!properties.getReconciliation().isScheduledAuditEnabled()) {
            return;
        }
        log.info("Starting scheduled balance audit...");

        List<String> userIds = ledgerStore.listUserIds();
        int drifted = 0;
        int violating = 0;
        for (String userId : userIds) {
            try {
                BalanceAuditResult audit = auditUserBalance(userId);
                if (!audit.isConsistent()) {
                    drifted++;
                }
                if (!audit.getIntegrityViolations().isEmpty()) {
                    violating++;
                    log.warn("Integrity violations for user {}: {}", userId, audit.getIntegrityViolations());
                }
            } catch (RuntimeException e) {
                log.error("Scheduled audit failed for user {}", userId, e);
            }
        }
        log.info("Scheduled balance audit complete: {} users checked, {} drifted, {} with integrity violations",
                userIds.size(), drifted, violating);
    }

    /**
     * Replay completed transactions through the live-path transitions.
     * COMMIT entries shift without the sufficiency check so a damaged history still replays.
     */
    UserBalance calculateBalance(String userId, List<TokenTransaction> transactions,
            List<PredictionCommitment> activeCommitments) {
        UserBalance replay = UserBalance.empty(userId);

        for (TokenTransaction tx : transactions) {
            double amount = Math.abs(tx.getAmount());
            replay = switch (tx.getType()) {
                case PURCHASE -> BalanceArithmetic.afterCredit(replay, amount);
                case COMMIT -> replay.toBuilder()
                        .availableTokens(replay.getAvailableTokens() - amount)
                        .committedTokens(replay.getCommittedTokens() + amount)
                        .version(replay.getVersion() + 1)
                        .build();
                case WIN -> BalanceArithmetic.afterWin(replay, stakeOf(tx), amount);
                case LOSS -> BalanceArithmetic.afterLoss(replay, amount);
                case REFUND -> BalanceArithmetic.afterRefund(replay, amount);
            };
        }

        double committed = activeCommitments.stream().mapToDouble(PredictionCommitment::getTokensCommitted).sum();
        return replay.toBuilder()
                .availableTokens(Math.max(0, replay.getAvailableTokens()))
                .committedTokens(committed)
                .build();
    }

    private List<BalanceInconsistency> detectInconsistencies(String userId, UserBalance stored, UserBalance calculated) {
        UserBalance reference = stored == null ? UserBalance.empty(userId) : stored;
        double tolerance = properties.getReconciliation().getTolerance();

        List<BalanceInconsistency> inconsistencies = new ArrayList<>();
        compare(userId, "availableTokens", reference.getAvailableTokens(), calculated.getAvailableTokens(), tolerance, inconsistencies);
        compare(userId, "committedTokens", reference.getCommittedTokens(), calculated.getCommittedTokens(), tolerance, inconsistencies);
        compare(userId, "totalEarned", reference.getTotalEarned(), calculated.getTotalEarned(), tolerance, inconsistencies);
        compare(userId, "totalSpent", reference.getTotalSpent(), calculated.getTotalSpent(), tolerance, inconsistencies);
        if (stored != null && !hasValidVersion(stored)) {
            double storedVersion = stored.getVersion() == null ? 0 : stored.getVersion();
            inconsistencies.add(new BalanceInconsistency(userId, "version", storedVersion, 1, 1 - storedVersion));
        }
        return inconsistencies;
    }

    private static void compare(String userId, String field, Double storedValue, double calculatedValue,
            double tolerance, List<BalanceInconsistency> inconsistencies) {
        // an undefined stored field always counts as drift
        double stored = isNumber(storedValue) ? storedValue : Double.NaN;
        if (Double.isNaN(stored) || Math.abs(stored - calculatedValue) > tolerance) {
            double difference = Double.isNaN(stored) ? calculatedValue : calculatedValue - stored;
            inconsistencies.add(new BalanceInconsistency(userId, field,
                    Double.isNaN(stored) ? 0 : stored, calculatedValue, difference));
        }
    }

    private static double stakeOf(TokenTransaction tx) {
        Map<String, Object> metadata = tx.getMetadata();
        Object stake = metadata == null ? null : metadata.get(TokenTransaction.META_TOKENS_COMMITTED);
        return stake instanceof Number ? ((Number) stake).doubleValue() : 0;
    }

    private static void checkNonNegative(Double value, String label, List<String> violations) {
        if (!isNumber(value)) {
            violations.add(label + " must be a valid number");
        } else if (value < 0) {
            violations.add(label + " cannot be negative");
        }
    }

    private static boolean hasValidVersion(UserBalance balance) {
        return balance != null && balance.getVersion() != null && balance.getVersion() > 0;
    }

    private static boolean isNumber(Double value) {
        return value != null && !value.isNaN() && !value.isInfinite();
    }

    private static String plain(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
