package com.smartmoneyradar.alert.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Per-asset sliding window of recent purchases, at most one record per wallet.
 * Not thread-safe: owned by {@link AlertEngine} and used under its lock.
 */
public class PurchaseWindow {

    private final Duration window;
    private final Map<String, List<PurchaseRecord>> byAsset = new HashMap<>();

    public PurchaseWindow(Duration window) {
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.window = window;
    }

    public boolean containsWallet(String asset, String wallet) {
        List<PurchaseRecord> records = byAsset.get(asset);
        if (records == null) {
            return false;
        }
        for (PurchaseRecord r : records) {
            if (r.wallet().equals(wallet)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Appends the record unless the wallet already has one for this asset.
     *
     * @return false when dropped as a repeat purchase
     */
    public boolean add(String asset, PurchaseRecord record) {
        if (containsWallet(asset, record.wallet())) {
            return false;
        }
        byAsset.computeIfAbsent(asset, a -> new ArrayList<>()).add(record);
        return true;
    }

    /**
     * Drops every record (all assets) whose age at {@code now} is not below the window; empty assets are removed.
     */
    public void prune(Instant now) {
        Instant cutoff = now.minus(window);
        Iterator<Map.Entry<String, List<PurchaseRecord>>> it = byAsset.entrySet().iterator();
        while (it.hasNext()) {
            List<PurchaseRecord> records = it.next().getValue();
            records.removeIf(r -> !r.acceptedAt().isAfter(cutoff));
            if (records.isEmpty()) {
                it.remove();
            }
        }
    }

    /** Live records of the asset in acceptance order (one per wallet). */
    public List<PurchaseRecord> records(String asset) {
        List<PurchaseRecord> records = byAsset.get(asset);
        return records == null ? List.of() : List.copyOf(records);
    }

    public int uniqueWalletCount(String asset) {
        List<PurchaseRecord> records = byAsset.get(asset);
        return records == null ? 0 : records.size();
    }

    public void clear(String asset) {
        byAsset.remove(asset);
    }

    public int assetCount() {
        return byAsset.size();
    }

    public void reset() {
        byAsset.clear();
    }

    public Duration getWindow() {
        return window;
    }
}
