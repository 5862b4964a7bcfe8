package com.smartmoneyradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Entry signal emitted with an alert (collection "trade_signals"), picked up by an external executor that moves
 * it through {@link Status}. At most one live signal per asset inside the signal cooldown.
 */
@Document(collection = "trade_signals")
@CompoundIndex(name = "asset_created", def = "{'assetMint': 1, 'createdAt': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TradeSignal {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String assetMint;
    private String symbol;
    /** Valuation at the alert that produced the signal, USD. */
    private BigDecimal entryValuationUsd;
    private Trigger trigger;
    private int walletCount;
    private Status status = Status.PENDING;
    private Instant createdAt;
    private Instant processedAt;

    public enum Trigger {
        /** First alert of a streak. */
        WALLET_CLUSTER,
        /** Re-alert inside the bullish window. */
        BULLISH
    }

    public enum Status {
        PENDING,
        PROCESSING,
        EXECUTED,
        SKIPPED,
        FAILED;

        /** Statuses that block a new signal for the same asset during the cooldown. */
        public static final Set<Status> LIVE = EnumSet.of(PENDING, PROCESSING, EXECUTED);
    }
}
