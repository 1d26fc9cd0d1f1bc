package com.prediction.market.token_ledger.exception;

/**
 * Thrown when a debit would take available tokens below zero.
 */
public class InsufficientBalanceException extends RuntimeException {

    private final double available;
    private final double required;

    public InsufficientBalanceException(double available, double required) {
        super(describe(available, required));
        this.available = available;
        this.required = required;
    }

    public double getAvailable() {
        return available;
    }

    public double getRequired() {
        return required;
    }

    public static String describe(double available, double required) {
        return String.format("Insufficient balance. Available: %s, Required: %s",
                formatAmount(available), formatAmount(required));
    }

    private static String formatAmount(double amount) {
        if (amount == Math.rint(amount) && !Double.isInfinite(amount)) {
            return String.valueOf((long) amount);
        }
        return String.valueOf(amount);
    }
}
