package com.smartmoneyradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One emitted alert (collection "alerts"). Written after the decision is made; never read back by the engine.
 */
@Document(collection = "alerts")
@CompoundIndex(name = "asset_created", def = "{'assetMint': 1, 'createdAt': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class AlertRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String assetMint;
    private String symbol;
    /** Valuation (market cap) at decision time, USD. */
    private BigDecimal alertValuationUsd;
    /** First-alert valuation of the current bullish streak, USD. */
    private BigDecimal baselineValuationUsd;
    private int walletCount;
    private List<String> wallets = new ArrayList<>();
    /** 1 for a fresh alert, N for the N-th alert of a bullish streak. */
    private int streakPosition;
    private boolean bullish;
    @Indexed
    private Instant createdAt;
}
