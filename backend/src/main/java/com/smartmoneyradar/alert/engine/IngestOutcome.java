package com.smartmoneyradar.alert.engine;

import com.smartmoneyradar.valuation.market.AssetSnapshot;

import java.math.BigDecimal;

/**
 * Result of {@link AlertEngine#ingest}. Every status except {@link Status#ACCEPTED} is terminal for the event.
 *
 * @param detail   breached threshold or reason, empty when accepted
 * @param snapshot snapshot used by the filters, null when rejected before the lookup
 */
public record IngestOutcome(Status status, String detail, AssetSnapshot snapshot, BigDecimal buyValueUsd) {

    public enum Status {
        ACCEPTED,
        DUPLICATE,
        EXCLUDED_ASSET,
        DUPLICATE_WALLET,
        SNAPSHOT_UNAVAILABLE,
        BELOW_MIN_LIQUIDITY,
        DUST,
        ABOVE_MAX_VALUATION,
        BELOW_MIN_VOLUME,
        BELOW_MIN_TXNS
    }

    static IngestOutcome accepted(AssetSnapshot snapshot, BigDecimal buyValueUsd) {
        return new IngestOutcome(Status.ACCEPTED, "", snapshot, buyValueUsd);
    }

    static IngestOutcome rejected(Status status, String detail) {
        return new IngestOutcome(status, detail, null, null);
    }

    static IngestOutcome rejected(Status status, String detail, AssetSnapshot snapshot) {
        return new IngestOutcome(status, detail, snapshot, null);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
