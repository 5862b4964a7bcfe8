package com.smartmoneyradar.store;

import java.util.Map;

/**
 * Per-wallet last-seen signature. Loaded once at startup, flushed periodically and on shutdown.
 */
public interface CheckpointStore {

    /** wallet -> last signature; empty when the store is unreachable. */
    Map<String, String> loadAll();

    /** Upserts every entry. Failures are logged, not thrown. */
    void saveAll(Map<String, String> checkpoints);
}
