package com.prediction.market.token_ledger.store;

import java.util.Optional;

import com.prediction.market.token_ledger.entity.Market;

/**
 * Read-only market lookup.
 */
public interface MarketProvider {

    Optional<Market> getMarket(String marketId);
}
