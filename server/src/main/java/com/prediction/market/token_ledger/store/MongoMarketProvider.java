package com.prediction.market.token_ledger.store;

import java.util.Optional;

import com.prediction.market.token_ledger.entity.Market;
import com.prediction.market.token_ledger.repositories.MarketRepository;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class MongoMarketProvider implements MarketProvider {

    private final MarketRepository marketRepository;

    @Override
    public Optional<Market> getMarket(String marketId) {
        if (marketId == null || marketId.isBlank()) {
            return Optional.empty();
        }
        return marketRepository.findById(marketId);
    }
}
