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

/**
 * Accepted purchase by a tracked wallet (collection "wallet_activity"). One document per (walletAddress, assetMint);
 * {@code early} is set when the wallet was part of an alert for the asset.
 */
@Document(collection = "wallet_activity")
@CompoundIndex(name = "wallet_asset", def = "{'walletAddress': 1, 'assetMint': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PurchaseEventRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String walletAddress;
    private String assetMint;
    private String symbol;
    private String signature;
    private BigDecimal nativeSpent;
    private BigDecimal valuationUsd;
    private boolean early;
    /** Valuation at the alert the wallet took part in; zero until then. */
    private BigDecimal alertValuationUsd = BigDecimal.ZERO;
    @Indexed
    private Instant createdAt;
}
