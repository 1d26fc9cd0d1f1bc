package com.prediction.market.token_ledger.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.prediction.market.token_ledger.config.LedgerProperties;
import com.prediction.market.token_ledger.dto.BalanceView;
import com.prediction.market.token_ledger.dto.TransactionHistory;
import com.prediction.market.token_ledger.dto.TransactionSummary;
import com.prediction.market.token_ledger.engine.BalanceArithmetic;
import com.prediction.market.token_ledger.entity.TokenTransaction;
import com.prediction.market.token_ledger.entity.TransactionType;
import com.prediction.market.token_ledger.entity.UserBalance;
import com.prediction.market.token_ledger.exception.BalanceNotFoundException;
import com.prediction.market.token_ledger.store.LedgerSession;
import com.prediction.market.token_ledger.store.LedgerStore;
import com.prediction.market.token_ledger.util.TokenFormatter;

import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Balance bootstrap, token credits and transaction history.
 *
 * Credits are recorded as PURCHASE entries so that reconciliation replays them the same way
 * they were applied.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenLedgerService {

    public static final String SOURCE_SIGNUP_BONUS = "signup_bonus";
    public static final String SOURCE_PURCHASE = "purchase";

    private final LedgerStore ledgerStore;
    private final LedgerProperties properties;
    private final Retry ledgerConflictRetry;
    private final Clock clock;

    public Optional<UserBalance> getBalance(String userId) {
        return ledgerStore.getBalance(requireUserId(userId));
    }

    /**
     * Stored balances of several users. Users without a balance are left out, as are IDs that
     * fail to load.
     */
    public List<UserBalance> getBalanceSummary(List<String> userIds) {
        if (userIds == null || userIds.isEmpty()) {
            return List.of();
        }
        List<UserBalance> balances = new ArrayList<>();
        for (String userId : userIds) {
            try {
                getBalance(userId).ifPresent(balances::add);
            } catch (RuntimeException e) {
                log.warn("Skipping balance of user {}: {}", userId, e.getMessage());
            }
        }
        return balances;
    }

    /**
     * Return the user's balance, creating it with the signup bonus on first access.
     *
     * @param userId the user ID
     * @return the stored balance, version 1 when just created
     */
    public UserBalance getOrCreateBalance(String userId) {
        String id = requireUserId(userId);
        Optional<UserBalance> existing = ledgerStore.getBalance(id);
        if (existing.isPresent()) {
            return existing.get();
        }
        return Retry.decorateSupplier(ledgerConflictRetry, () -> ledgerStore.inTransaction(session -> {
            Optional<UserBalance> current = session.getBalance(id);
            if (current.isPresent()) {
                return current.get();
            }
            UserBalance created = createInitialBalance(session, id);
            log.info("Balance created for user {} with signup bonus {}", id, properties.getSignupBonus());
            return created;
        })).get();
    }

    /**
     * Credit purchased tokens. The USD amount is kept on the ledger entry for audit.
     *
     * @param userId the buyer
     * @param tokens tokens credited, must be positive
     * @param usdAmount amount charged by the payment provider
     * @param paymentReference provider reference, optional
     * @return the balance after the credit
     */
    public UserBalance recordPurchase(String userId, double tokens, double usdAmount, String paymentReference) {
        String id = requireUserId(userId);
        if (!(tokens > 0) || Double.isInfinite(tokens)) {
            throw new IllegalArgumentException("Purchased tokens must be positive");
        }
        if (usdAmount < 0 || Double.isNaN(usdAmount)) {
            throw new IllegalArgumentException("USD amount cannot be negative");
        }

        UserBalance updated = Retry.decorateSupplier(ledgerConflictRetry, () -> ledgerStore.inTransaction(session -> {
            UserBalance balance = session.getBalance(id).orElseGet(() -> createInitialBalance(session, id));

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(TokenTransaction.META_SOURCE, SOURCE_PURCHASE);
            metadata.put(TokenTransaction.META_USD_AMOUNT, usdAmount);
            if (paymentReference != null) {
                metadata.put(TokenTransaction.META_PAYMENT_REFERENCE, paymentReference);
            }
            return credit(session, balance, tokens, paymentReference, metadata);
        })).get();

        log.info("Purchase recorded: userId={}, tokens={}, usd={}, reference={}",
                id, tokens, usdAmount, paymentReference);
        return updated;
    }

    public BalanceView getBalanceView(String userId) {
        return toView(getOrCreateBalance(userId));
    }

    /**
     * Completed ledger entries, newest first, with totals per type.
     */
    public TransactionHistory getTransactionHistory(String userId) {
        String id = requireUserId(userId);
        List<TokenTransaction> transactions = new ArrayList<>(ledgerStore.listTransactions(id));
        TransactionSummary summary = summarize(transactions);
        Collections.reverse(transactions);
        return new TransactionHistory(id, transactions, summary);
    }

    public static TransactionSummary summarize(List<TokenTransaction> transactions) {
        double purchased = 0;
        double committed = 0;
        double won = 0;
        double lost = 0;
        double refunded = 0;
        double netChange = 0;

        for (TokenTransaction tx : transactions) {
            switch (tx.getType()) {
                case PURCHASE -> purchased += tx.getAmount();
                case COMMIT -> committed += tx.getAmount();
                case WIN -> won += tx.getAmount();
                case LOSS -> lost += tx.getAmount();
                case REFUND -> refunded += tx.getAmount();
            }
            netChange += tx.getBalanceAfter() - tx.getBalanceBefore();
        }

        return TransactionSummary.builder()
                .totalPurchased(purchased)
                .totalCommitted(committed)
                .totalWon(won)
                .totalLost(lost)
                .totalRefunded(refunded)
                .netChange(netChange)
                .transactionCount(transactions.size())
                .build();
    }

    public static BalanceView toView(UserBalance balance) {
        double total = BalanceArithmetic.totalBalance(balance);
        double net = BalanceArithmetic.netProfitLoss(balance);
        return BalanceView.builder()
                .userId(balance.getUserId())
                .availableTokens(balance.getAvailableTokens())
                .committedTokens(balance.getCommittedTokens())
                .totalEarned(balance.getTotalEarned())
                .totalSpent(balance.getTotalSpent())
                .totalBalance(total)
                .netProfitLoss(net)
                .formattedAvailable(TokenFormatter.formatTokens(balance.getAvailableTokens()))
                .formattedCommitted(TokenFormatter.formatTokens(balance.getCommittedTokens()))
                .formattedTotal(TokenFormatter.formatTokens(total))
                .formattedNetProfitLoss(TokenFormatter.formatSigned(net))
                .version(balance.getVersion() == null ? 0L : balance.getVersion())
                .lastUpdated(balance.getLastUpdated())
                .build();
    }

    private UserBalance createInitialBalance(LedgerSession session, String userId) {
        UserBalance empty = UserBalance.empty(userId);
        double bonus = properties.getSignupBonus();
        if (bonus <= 0) {
            UserBalance created = empty.toBuilder().version(1L).lastUpdated(clock.millis()).build();
            session.putBalance(created, 0L);
            return created;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(TokenTransaction.META_SOURCE, SOURCE_SIGNUP_BONUS);
        return credit(session, empty, bonus, null, metadata);
    }

    private UserBalance credit(LedgerSession session, UserBalance balance, double tokens, String relatedId,
            Map<String, Object> metadata) {
        long now = clock.millis();
        UserBalance updated = BalanceArithmetic.afterCredit(balance, tokens).toBuilder()
                .lastUpdated(now)
                .build();
        session.putBalance(updated, balance.getVersion());
        session.appendTransaction(TokenTransaction.builder()
                .id(UUID.randomUUID().toString())
                .userId(balance.getUserId())
                .type(TransactionType.PURCHASE)
                .amount(tokens)
                .balanceBefore(balance.getAvailableTokens())
                .balanceAfter(updated.getAvailableTokens())
                .relatedId(relatedId)
                .metadata(metadata)
                .timestamp(now)
                .build());
        return updated;
    }

    static String requireUserId(String userId) {
        if (userId == null || userId.trim().isEmpty()) {
            throw new IllegalArgumentException("User ID is required");
        }
        return userId.trim();
    }
}
