package com.prediction.market.token_ledger.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Tokens bought through the payment provider. Payment itself happens elsewhere;
 * the ledger only records the credit.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class PurchaseRequest {
    @NotNull
    @Positive
    private Double tokens;

    @PositiveOrZero
    private double usdAmount;

    private String paymentReference;
}
