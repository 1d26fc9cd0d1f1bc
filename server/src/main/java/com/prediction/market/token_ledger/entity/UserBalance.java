package com.prediction.market.token_ledger.entity;

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
 * Per-user token balance. One document per user, keyed by userId.
 *
 * Amounts are boxed so a document with a missing field surfaces as {@code null}
 * instead of silently reading as zero; integrity checks treat that as invalid.
 *
 * Every mutation goes through a version-guarded write: a writer reads the balance
 * with its {@code version}, computes the next balance and commits only if the stored
 * version is unchanged. Valid versions start at 1.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "user_balances")
public class UserBalance {

    @MongoId(FieldType.STRING)
    private String userId;

    /** Spendable balance. */
    private Double availableTokens;

    /** Tokens locked against active commitments. */
    private Double committedTokens;

    private Double totalEarned;
    private Double totalSpent;

    private Long version;

    private long lastUpdated;

    /**
     * Empty balance for a user who has never been credited. Version 0 marks it as not yet stored.
     */
    public static UserBalance empty(String userId) {
        return UserBalance.builder()
                .userId(userId)
                .availableTokens(0.0)
                .committedTokens(0.0)
                .totalEarned(0.0)
                .totalSpent(0.0)
                .version(0L)
                .build();
    }
}
