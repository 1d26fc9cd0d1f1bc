package com.prediction.market.token_ledger.entity;

import java.util.ArrayList;
import java.util.List;

import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.FieldType;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Market as seen by the ledger. Owned and written by the market service;
 * the ledger only reads it to validate and price commitments.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "markets")
public class Market {

    @MongoId(FieldType.STRING)
    private String id;

    private String title;

    private MarketStatus status;

    /** End of trading, epoch millis. */
    private Long endDate;

    private int totalParticipants;

    @Builder.Default
    private List<MarketOption> options = new ArrayList<>();

    public boolean hasOptions() {
        return options != null && !options.isEmpty();
    }

    public double getTotalTokens() {
        if (!hasOptions()) {
            return 0;
        }
        return options.stream().mapToDouble(MarketOption::getTotalTokens).sum();
    }
}
