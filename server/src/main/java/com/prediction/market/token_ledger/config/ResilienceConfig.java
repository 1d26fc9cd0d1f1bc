package com.prediction.market.token_ledger.config;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.prediction.market.token_ledger.exception.ConcurrentBalanceModificationException;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Retry policy for optimistic-concurrency conflicts on balance writes.
 *
 * Only version conflicts are retried; validation failures and everything else
 * propagate on the first attempt.
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    public static final String LEDGER_CONFLICT_RETRY = "ledgerConflict";

    @Bean
    public Retry ledgerConflictRetry(LedgerProperties properties) {
        LedgerProperties.Retry retry = properties.getRetry();
        log.info("Initializing ledger conflict retry: maxAttempts={}, wait={}",
                retry.getMaxAttempts(), retry.getWaitDuration());
        return conflictRetry(retry.getMaxAttempts(), retry.getWaitDuration());
    }

    public static Retry conflictRetry(int maxAttempts, Duration waitDuration) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .waitDuration(waitDuration)
                .retryExceptions(ConcurrentBalanceModificationException.class)
                .build();

        Retry retry = Retry.of(LEDGER_CONFLICT_RETRY, config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying ledger write after conflict (attempt {}): {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "n/a"));
        return retry;
    }
}
