package com.prediction.market.token_ledger.dto;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class MarketCreationRequest {
    private String title;
    private String description;
    /** Epoch millis. */
    private Long endDate;
    @Builder.Default
    private List<String> options = new ArrayList<>();
}
