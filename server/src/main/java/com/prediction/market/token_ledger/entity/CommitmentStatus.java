package com.prediction.market.token_ledger.entity;

/**
 * Commitment lifecycle.
 *
 * ACTIVE → WON      (market resolved in the commitment's favour)
 * ACTIVE → LOST     (market resolved against it)
 * ACTIVE → REFUNDED (market cancelled or commitment rolled back)
 *
 * WON, LOST and REFUNDED are terminal.
 */
public enum CommitmentStatus {

    ACTIVE,
    WON,
    LOST,
    REFUNDED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }

    /**
     * @param to the target state
     * @return true if the transition is legal
     */
    public boolean canTransitionTo(CommitmentStatus to) {
        return switch (this) {
            case ACTIVE -> to == WON || to == LOST || to == REFUNDED;
            default -> false;
        };
    }
}
