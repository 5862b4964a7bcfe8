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
 * Post-alert valuation lifecycle of one alert (collection "token_evaluations"), keyed by (assetMint, alertTime).
 * Each scheduled check appends a {@link Check}; peakValuationUsd only ever grows.
 */
@Document(collection = "token_evaluations")
@CompoundIndex(name = "asset_alert_time", def = "{'assetMint': 1, 'alertTime': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TokenEvaluation {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String assetMint;
    private String symbol;
    private BigDecimal alertValuationUsd;
    private Instant alertTime;
    private List<String> wallets = new ArrayList<>();
    /** All-time-high valuation observed across checks; starts at the alert valuation. */
    private BigDecimal peakValuationUsd;
    /** Latest thresholded classification; null until a thresholded check ran. */
    @Indexed
    private ValuationOutcome classification;
    private List<Check> checks = new ArrayList<>();
    @Indexed
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * A single scheduled check (offset-1..offset-4).
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Check {
        private String checkpoint;
        private long offsetSeconds;
        private BigDecimal valuationUsd;
        /** Fractional change versus the alert valuation, e.g. 0.25 = +25%. */
        private double change;
        private ValuationOutcome outcome;
        private Instant checkedAt;
    }
}
