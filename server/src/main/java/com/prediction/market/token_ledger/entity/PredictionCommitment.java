package com.prediction.market.token_ledger.entity;

import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
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
 * A user's stake of tokens on one option of a market.
 *
 * Created atomically with the matching balance debit. {@code optionId} is the source of truth
 * for the selected option; {@code position} is kept for legacy yes/no consumers.
 * Only {@link #resolve(CommitmentStatus, long)} changes a commitment after creation.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "prediction_commitments")
@CompoundIndex(name = "user_status_idx", def = "{'userId':1,'status':1}")
@CompoundIndex(name = "prediction_status_idx", def = "{'predictionId':1,'status':1}")
public class PredictionCommitment {

    @MongoId(FieldType.STRING)
    private String id;

    @Indexed
    private String userId;

    /** Market id under its legacy name. */
    private String predictionId;

    /** Same value as {@link #predictionId}. */
    private String marketId;

    private Position position;
    private String optionId;

    private int tokensCommitted;
    private double odds;
    private long potentialWinning;

    @Builder.Default
    private CommitmentStatus status = CommitmentStatus.ACTIVE;

    private long committedAt;
    private Long resolvedAt;

    private CommitmentMetadata metadata;

    public boolean isActive() {
        return status == CommitmentStatus.ACTIVE;
    }

    /**
     * Move this commitment to a terminal state.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public void resolve(CommitmentStatus target, long timestamp) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                    String.format("Commitment %s cannot move from %s to %s", id, status, target));
        }
        this.status = target;
        this.resolvedAt = timestamp;
    }

    /** Winnings beyond the returned stake. */
    public long getProfit() {
        return Math.max(0, potentialWinning - tokensCommitted);
    }
}
