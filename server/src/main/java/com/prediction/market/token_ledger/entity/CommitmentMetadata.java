package com.prediction.market.token_ledger.entity;

import java.util.HashMap;
import java.util.Map;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Immutable snapshot taken when a commitment is created.
 * Typed fields are required; {@link #extensions} carries free-form additions.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class CommitmentMetadata {

    private MarketStatus marketStatus;
    private String marketTitle;
    private Long marketEndsAt;

    private OddsSnapshot oddsSnapshot;

    private double userBalanceAtCommitment;

    @Builder.Default
    private CommitmentSource source = CommitmentSource.WEB;
    private String ipAddress;
    private String userAgent;

    private String selectedOptionText;
    private int marketOptionCount;

    @Builder.Default
    private Map<String, Object> extensions = new HashMap<>();
}
