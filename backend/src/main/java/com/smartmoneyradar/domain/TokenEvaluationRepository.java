package com.smartmoneyradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for token_evaluations per (assetMint, alertTime).
 */
public interface TokenEvaluationRepository extends MongoRepository<TokenEvaluation, String> {

    Optional<TokenEvaluation> findByAssetMintAndAlertTime(String assetMint, Instant alertTime);

    List<TokenEvaluation> findByAssetMint(String assetMint);

    long deleteByCreatedAtBefore(Instant cutoff);
}
