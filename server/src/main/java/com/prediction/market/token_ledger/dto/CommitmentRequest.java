package com.prediction.market.token_ledger.dto;

import com.prediction.market.token_ledger.entity.Position;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Request to stake tokens on a market. Callers give {@code position}, {@code optionId} or both;
 * the market may be named by {@code predictionId} (legacy) or {@code marketId}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class CommitmentRequest {
    private String userId;
    private String predictionId;
    private String marketId;
    private Position position;
    private String optionId;

    /** Kept as a double so malformed amounts reach validation instead of being coerced. */
    private Double tokensToCommit;

    private ClientInfo clientInfo;

    /**
     * The market id, preferring {@code marketId} over the legacy {@code predictionId}.
     */
    public String resolveMarketId() {
        if (marketId != null && !marketId.isBlank()) {
            return marketId.trim();
        }
        return predictionId == null ? null : predictionId.trim();
    }
}
