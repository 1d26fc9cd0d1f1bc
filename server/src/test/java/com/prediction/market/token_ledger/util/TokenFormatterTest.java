package com.prediction.market.token_ledger.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TokenFormatterTest {

    @Test
    @DisplayName("amounts below a thousand print as whole numbers")
    void smallAmounts() {
        assertThat(TokenFormatter.formatTokens(0)).isEqualTo("0");
        assertThat(TokenFormatter.formatTokens(999)).isEqualTo("999");
        assertThat(TokenFormatter.formatTokens(12.6)).isEqualTo("13");
    }

    @Test
    @DisplayName("thousands and millions use one decimal with a suffix")
    void suffixes() {
        assertThat(TokenFormatter.formatTokens(2500)).isEqualTo("2.5K");
        assertThat(TokenFormatter.formatTokens(3250)).isEqualTo("3.3K");
        assertThat(TokenFormatter.formatTokens(1_000)).isEqualTo("1.0K");
        assertThat(TokenFormatter.formatTokens(1_250_000)).isEqualTo("1.3M");
        assertThat(TokenFormatter.formatTokens(-2500)).isEqualTo("-2.5K");
    }

    @Test
    @DisplayName("undefined amounts print as zero")
    void undefined() {
        assertThat(TokenFormatter.formatTokens(Double.NaN)).isEqualTo("0");
        assertThat(TokenFormatter.formatTokens(Double.POSITIVE_INFINITY)).isEqualTo("0");
    }

    @Test
    @DisplayName("signed format prefixes gains with a plus")
    void signed() {
        assertThat(TokenFormatter.formatSigned(400)).isEqualTo("+400");
        assertThat(TokenFormatter.formatSigned(-400)).isEqualTo("-400");
        assertThat(TokenFormatter.formatSigned(0)).isEqualTo("0");
    }

    @Test
    void odds() {
        assertThat(TokenFormatter.formatOdds(1.6)).isEqualTo("1.60x");
        assertThat(TokenFormatter.formatOdds(2.666)).isEqualTo("2.67x");
    }
}
