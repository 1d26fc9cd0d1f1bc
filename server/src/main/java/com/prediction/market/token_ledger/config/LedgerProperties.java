package com.prediction.market.token_ledger.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Ledger settings, bound from {@code ledger.*} in application.properties.
 */
@ConfigurationProperties(prefix = "ledger")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class LedgerProperties {

    /** Backing store: {@code mongo} or {@code memory}. */
    @NotBlank
    private String store = "mongo";

    /** Tokens granted when a balance is first created. */
    @PositiveOrZero
    private double signupBonus = 1000;

    @Valid
    private Commitment commitment = new Commitment();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Reconciliation reconciliation = new Reconciliation();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Commitment {
        @Min(1)
        private int minTokens = 1;

        @Min(1)
        private int maxTokens = 1000;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {
        /** Attempts including the first one. */
        @Min(1)
        private int maxAttempts = 3;

        private Duration waitDuration = Duration.ofMillis(50);
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Reconciliation {
        /** Floating point tolerance for integrity checks and audit diffs. */
        @PositiveOrZero
        private double tolerance = 0.01;

        private boolean scheduledAuditEnabled = false;

        private long auditIntervalMs = 300_000L;
    }
}
