package com.prediction.market.token_ledger.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Display strings for token amounts: 2500 becomes "2.5K", 3250 becomes "3.3K".
 */
public final class TokenFormatter {

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1_000);
    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000);

    private TokenFormatter() {
    }

    public static String formatTokens(double amount) {
        if (Double.isNaN(amount) || Double.isInfinite(amount)) {
            return "0";
        }
        BigDecimal value = BigDecimal.valueOf(amount);
        BigDecimal magnitude = value.abs();
        if (magnitude.compareTo(MILLION) >= 0) {
            return scaled(value, MILLION) + "M";
        }
        if (magnitude.compareTo(THOUSAND) >= 0) {
            return scaled(value, THOUSAND) + "K";
        }
        return value.setScale(0, RoundingMode.HALF_UP).toPlainString();
    }

    /**
     * Same as {@link #formatTokens(double)} with an explicit sign, for profit/loss.
     */
    public static String formatSigned(double amount) {
        String formatted = formatTokens(amount);
        return amount > 0 ? "+" + formatted : formatted;
    }

    public static String formatOdds(double odds) {
        return BigDecimal.valueOf(odds).setScale(2, RoundingMode.HALF_UP).toPlainString() + "x";
    }

    private static String scaled(BigDecimal value, BigDecimal unit) {
        return value.divide(unit, 1, RoundingMode.HALF_UP).toPlainString();
    }
}
