package com.prediction.market.token_ledger.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.token_ledger.entity.Market;

@Repository
public interface MarketRepository extends MongoRepository<Market, String> {
}
