package com.smartmoneyradar.valuation.market;

import java.util.Optional;

/**
 * External valuation lookup. Empty means unknown (no pair listed, transport failure, throttled).
 */
public interface AssetSnapshotProvider {

    Optional<AssetSnapshot> getAssetSnapshot(String mint);
}
