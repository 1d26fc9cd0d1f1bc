package com.prediction.market.token_ledger.store;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.prediction.market.token_ledger.entity.Market;

/**
 * Market lookup backed by a map, used with the in-memory ledger store.
 */
public class InMemoryMarketProvider implements MarketProvider {

    private final Map<String, Market> markets = new ConcurrentHashMap<>();

    @Override
    public Optional<Market> getMarket(String marketId) {
        if (marketId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(markets.get(marketId));
    }

    public void put(Market market) {
        markets.put(market.getId(), market);
    }

    public void remove(String marketId) {
        markets.remove(marketId);
    }
}
