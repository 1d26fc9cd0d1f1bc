package com.prediction.market.token_ledger.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.prediction.market.token_ledger.repositories.MarketRepository;
import com.prediction.market.token_ledger.repositories.PredictionCommitmentRepository;
import com.prediction.market.token_ledger.repositories.TokenTransactionRepository;
import com.prediction.market.token_ledger.repositories.UserBalanceRepository;
import com.prediction.market.token_ledger.store.MongoLedgerStore;
import com.prediction.market.token_ledger.store.MongoMarketProvider;

/**
 * MongoDB-backed ledger. Multi-document transactions need a replica set.
 */
@Configuration
@ConditionalOnProperty(name = "ledger.store", havingValue = "mongo", matchIfMissing = true)
public class MongoConfig {

    @Bean
    MongoTransactionManager mongoTransactionManager(MongoDatabaseFactory databaseFactory) {
        return new MongoTransactionManager(databaseFactory);
    }

    @Bean
    TransactionTemplate ledgerTransactionTemplate(MongoTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    public MongoLedgerStore mongoLedgerStore(UserBalanceRepository balanceRepository,
            TokenTransactionRepository transactionRepository,
            PredictionCommitmentRepository commitmentRepository,
            TransactionTemplate ledgerTransactionTemplate) {
        return new MongoLedgerStore(balanceRepository, transactionRepository, commitmentRepository,
                ledgerTransactionTemplate);
    }

    @Bean
    public MongoMarketProvider mongoMarketProvider(MarketRepository marketRepository) {
        return new MongoMarketProvider(marketRepository);
    }
}
