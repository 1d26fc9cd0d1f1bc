package com.prediction.market.token_ledger.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;
import org.springframework.stereotype.Repository;

import com.prediction.market.token_ledger.entity.UserBalance;

/**
 * Repository for user balances with version-guarded updates.
 *
 * CRITICAL: balance documents are only ever changed through {@link #compareAndSetBalance}
 * so concurrent writers cannot lose each other's updates.
 */
@Repository
public interface UserBalanceRepository extends MongoRepository<UserBalance, String> {

    /**
     * Atomically replace the balance fields if the stored version still matches.
     *
     * @param userId the balance owner
     * @param expectedVersion version read before computing the new balance; {@code null} matches
     *        a document whose version is missing
     * @return number of documents modified (1 if successful, 0 on version mismatch)
     */
    @Query("{ '_id': ?0, 'version': ?1 }")
    @Update("{ $set: { " +
            "'availableTokens': ?2, " +
            "'committedTokens': ?3, " +
            "'totalEarned': ?4, " +
            "'totalSpent': ?5, " +
            "'version': ?6, " +
            "'lastUpdated': ?7 " +
            "} }")
    long compareAndSetBalance(
        String userId,
        Long expectedVersion,
        double availableTokens,
        double committedTokens,
        double totalEarned,
        double totalSpent,
        long newVersion,
        long lastUpdated
    );
}
