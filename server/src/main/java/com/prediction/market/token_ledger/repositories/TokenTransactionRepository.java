package com.prediction.market.token_ledger.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.token_ledger.entity.TokenTransaction;
import com.prediction.market.token_ledger.entity.TransactionStatus;

@Repository
public interface TokenTransactionRepository extends MongoRepository<TokenTransaction, String> {

    /**
     * Ledger entries of a user in the order they happened, used for reconciliation replay.
     */
    List<TokenTransaction> findByUserIdAndStatusOrderByTimestampAsc(String userId, TransactionStatus status);
}
