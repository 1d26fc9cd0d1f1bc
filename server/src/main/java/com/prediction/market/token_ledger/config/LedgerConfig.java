package com.prediction.market.token_ledger.config;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.prediction.market.token_ledger.store.InMemoryLedgerStore;
import com.prediction.market.token_ledger.store.InMemoryMarketProvider;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "ledger.store", havingValue = "memory")
    public InMemoryLedgerStore inMemoryLedgerStore() {
        return new InMemoryLedgerStore();
    }

    @Bean
    @ConditionalOnProperty(name = "ledger.store", havingValue = "memory")
    public InMemoryMarketProvider inMemoryMarketProvider() {
        return new InMemoryMarketProvider();
    }
}
