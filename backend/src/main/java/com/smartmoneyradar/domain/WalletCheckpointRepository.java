package com.smartmoneyradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface WalletCheckpointRepository extends MongoRepository<WalletCheckpoint, String> {

    Optional<WalletCheckpoint> findByWalletAddress(String walletAddress);
}
