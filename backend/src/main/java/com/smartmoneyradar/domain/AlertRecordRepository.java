package com.smartmoneyradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

/**
 * Persistence for alerts. Used by the decision store, the daily report and the retention job.
 */
public interface AlertRecordRepository extends MongoRepository<AlertRecord, String> {

    List<AlertRecord> findByAssetMintOrderByCreatedAtDesc(String assetMint);

    /** Alerts created in [from, to), oldest first. */
    List<AlertRecord> findByCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByCreatedAtAsc(Instant from, Instant to);

    /** Retention: removes alerts older than the cutoff; returns the number removed. */
    long deleteByCreatedAtBefore(Instant cutoff);
}
