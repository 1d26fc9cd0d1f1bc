package com.prediction.market.token_ledger.entity;

import java.util.HashMap;
import java.util.Map;

import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.FieldType;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Append-only ledger entry, one per balance-affecting event.
 * Completed entries are never modified and are the source of truth for reconciliation.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "token_transactions")
@CompoundIndex(name = "user_timestamp_idx", def = "{'userId':1,'timestamp':1}")
public class TokenTransaction {

    public static final String META_SOURCE = "source";
    public static final String META_TOKENS_COMMITTED = "tokensCommitted";
    public static final String META_USD_AMOUNT = "usdAmount";
    public static final String META_PAYMENT_REFERENCE = "paymentReference";
    public static final String META_MARKET_ID = "marketId";
    public static final String META_OPTION_ID = "optionId";
    public static final String META_REASON = "reason";

    @MongoId(FieldType.STRING)
    private String id;

    @Indexed
    private String userId;

    private TransactionType type;

    /** Always positive; the direction follows from {@link #type}. */
    private double amount;

    /** Available tokens before the event. */
    private double balanceBefore;

    /** Available tokens after the event. */
    private double balanceAfter;

    /** Commitment or market this entry refers to. */
    private String relatedId;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    private long timestamp;

    @Builder.Default
    private TransactionStatus status = TransactionStatus.COMPLETED;

    public boolean isCompleted() {
        return status == TransactionStatus.COMPLETED;
    }
}
