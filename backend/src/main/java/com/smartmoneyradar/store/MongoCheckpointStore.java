package com.smartmoneyradar.store;

import com.smartmoneyradar.domain.WalletCheckpoint;
import com.smartmoneyradar.domain.WalletCheckpointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Checkpoints in the "wallet_checkpoints" collection, one document per wallet.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MongoCheckpointStore implements CheckpointStore {

    private final WalletCheckpointRepository repository;

    @Override
    public Map<String, String> loadAll() {
        try {
            Map<String, String> out = new HashMap<>();
            for (WalletCheckpoint cp : repository.findAll()) {
                if (cp.getWalletAddress() != null && cp.getLastSignature() != null) {
                    out.put(cp.getWalletAddress(), cp.getLastSignature());
                }
            }
            return out;
        } catch (Exception e) {
            log.warn("Persistence failure: checkpoints not loaded, starting from latest: {}", e.getMessage());
            return Map.of();
        }
    }

    @Override
    public void saveAll(Map<String, String> checkpoints) {
        if (checkpoints.isEmpty()) {
            return;
        }
        try {
            Map<String, WalletCheckpoint> existing = repository.findAll().stream()
                    .filter(cp -> cp.getWalletAddress() != null)
                    .collect(Collectors.toMap(WalletCheckpoint::getWalletAddress, Function.identity(), (a, b) -> a));
            Instant now = Instant.now();
            List<WalletCheckpoint> toSave = new ArrayList<>();
            checkpoints.forEach((wallet, signature) -> {
                WalletCheckpoint cp = existing.get(wallet);
                if (cp == null) {
                    cp = new WalletCheckpoint();
                    cp.setWalletAddress(wallet);
                } else if (signature.equals(cp.getLastSignature())) {
                    return;
                }
                cp.setLastSignature(signature);
                cp.setUpdatedAt(now);
                toSave.add(cp);
            });
            if (!toSave.isEmpty()) {
                repository.saveAll(toSave);
            }
            log.debug("Checkpoints flushed: {} changed of {}", toSave.size(), checkpoints.size());
        } catch (Exception e) {
            log.warn("Persistence failure: checkpoints not flushed: {}", e.getMessage());
        }
    }
}
