package com.smartmoneyradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for wallet_activity.
 */
public interface PurchaseEventRecordRepository extends MongoRepository<PurchaseEventRecord, String> {

    Optional<PurchaseEventRecord> findByWalletAddressAndAssetMint(String walletAddress, String assetMint);

    List<PurchaseEventRecord> findByAssetMintAndWalletAddressIn(String assetMint, List<String> walletAddresses);

    long deleteByCreatedAtBefore(Instant cutoff);
}
