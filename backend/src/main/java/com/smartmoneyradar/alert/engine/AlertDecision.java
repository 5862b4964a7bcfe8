package com.smartmoneyradar.alert.engine;

import com.smartmoneyradar.valuation.market.AssetSnapshot;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * An alert the engine decided to raise. {@code wallets} holds every unique wallet in the window;
 * notifiers show {@link #displayWallets()}.
 *
 * @param snapshot             fresh snapshot taken at decision time
 * @param streakPosition       1 for a fresh alert, N for the N-th alert of a bullish streak
 * @param baselineValuationUsd first-alert valuation of the streak (current valuation when fresh)
 */
public record AlertDecision(
        String assetMint,
        List<WalletPurchase> wallets,
        AssetSnapshot snapshot,
        int streakPosition,
        BigDecimal baselineValuationUsd,
        int effectiveThreshold,
        Instant decidedAt
) {

    public static final int DISPLAY_WALLET_LIMIT = 5;

    public AlertDecision {
        wallets = List.copyOf(wallets);
    }

    public int walletCount() {
        return wallets.size();
    }

    public boolean isBullish() {
        return streakPosition > 1;
    }

    public List<WalletPurchase> displayWallets() {
        return wallets.size() <= DISPLAY_WALLET_LIMIT ? wallets : wallets.subList(0, DISPLAY_WALLET_LIMIT);
    }

    public List<String> walletAddresses() {
        return wallets.stream().map(WalletPurchase::wallet).toList();
    }

    public BigDecimal currentValuationUsd() {
        return snapshot.marketValuationUsd();
    }

    public String symbol() {
        return snapshot.symbol();
    }
}
