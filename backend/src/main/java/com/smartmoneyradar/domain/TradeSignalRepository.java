package com.smartmoneyradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Collection;

public interface TradeSignalRepository extends MongoRepository<TradeSignal, String> {

    boolean existsByAssetMintAndStatusInAndCreatedAtAfter(String assetMint, Collection<TradeSignal.Status> statuses,
                                                          Instant since);
}
