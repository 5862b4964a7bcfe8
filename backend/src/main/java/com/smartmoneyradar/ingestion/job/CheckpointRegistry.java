package com.smartmoneyradar.ingestion.job;

import com.smartmoneyradar.store.CheckpointStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory per-wallet last-seen signature. Loaded from the store at startup; written back by
 * {@link CheckpointFlushJob}.
 */
@Component
@Slf4j
public class CheckpointRegistry {

    private final CheckpointStore checkpointStore;
    private final Map<String, String> lastSignatures = new ConcurrentHashMap<>();

    public CheckpointRegistry(CheckpointStore checkpointStore) {
        this.checkpointStore = checkpointStore;
    }

    @PostConstruct
    public void load() {
        Map<String, String> loaded = checkpointStore.loadAll();
        lastSignatures.putAll(loaded);
        log.info("Checkpoints loaded: {} wallets", loaded.size());
    }

    public Optional<String> get(String wallet) {
        return Optional.ofNullable(lastSignatures.get(wallet));
    }

    public void update(String wallet, String signature) {
        lastSignatures.put(wallet, signature);
    }

    public Map<String, String> snapshot() {
        return new HashMap<>(lastSignatures);
    }

    public void flush() {
        Map<String, String> current = snapshot();
        if (current.isEmpty()) {
            return;
        }
        checkpointStore.saveAll(current);
        log.debug("Checkpoints flushed: {} wallets", current.size());
    }
}
