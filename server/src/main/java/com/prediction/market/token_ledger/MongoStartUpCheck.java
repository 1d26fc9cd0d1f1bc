package com.prediction.market.token_ledger;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import com.prediction.market.token_ledger.entity.PredictionCommitment;
import com.prediction.market.token_ledger.entity.TokenTransaction;
import com.prediction.market.token_ledger.entity.UserBalance;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "ledger.store", havingValue = "mongo", matchIfMissing = true)
public class MongoStartUpCheck {

    private final MongoTemplate mongoTemplate;

    @PostConstruct
    public void checkMongoConnection() {
        try {
            long balances = mongoTemplate.count(new Query(), UserBalance.class);
            long transactions = mongoTemplate.count(new Query(), TokenTransaction.class);
            long commitments = mongoTemplate.count(new Query(), PredictionCommitment.class);
            log.info("MongoDB connection successful: {} balances, {} transactions, {} commitments",
                    balances, transactions, commitments);
        } catch (RuntimeException e) {
            throw new IllegalStateException("MongoDB connection failed", e);
        }
    }
}
