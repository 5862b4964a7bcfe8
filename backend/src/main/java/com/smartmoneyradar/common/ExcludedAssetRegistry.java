package com.smartmoneyradar.common;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Registry of Solana base/stable assets that never count as a smart-money purchase (wSOL, stablecoins,
 * liquid staking tokens, large caps). Mints are base58 and compared exactly; symbols case-insensitively.
 */
public class ExcludedAssetRegistry {

    public static final String WRAPPED_SOL_MINT = "So11111111111111111111111111111111111111112";

    private static final Set<String> WELL_KNOWN_MINTS = Set.of(
            WRAPPED_SOL_MINT,
            "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v",  // USDC
            "Es9vMFrzaCERmJfrF4H2FYD4KCoNkY11McCe8BenwNYB",  // USDT
            "mSoLzYCxHdYgdzU16g5QSh3i5K3z3KZK7ytfqcJm7So",   // mSOL
            "7dHbWXmci3dT8UFYWYZweBLXgycu7Y3iL6trKn1Y7ARj",  // stSOL
            "J1toso1uCk3RLmjorhTtrVwY9HJ7X8V9yYac6Y7kGCPn",  // JitoSOL
            "bSo13r4TkiE4KumL71LsHTPpL2euBYLFx6h9HP3piy1",   // bSOL
            "DezXAZ8z7PnrnRJjz3wXBoRgixCa6xjnB7YaB1pPB263",  // BONK
            "JUPyiwrYJFskUPiHa7hkeR8VUtAeFoSYbKedZNsDvCN"    // JUP
    );

    private static final Set<String> WELL_KNOWN_SYMBOLS = Set.of(
            "SOL", "WSOL", "USDC", "USDT", "MSOL", "STSOL", "JITOSOL", "BSOL", "JUP"
    );

    private final Set<String> mints;
    private final Set<String> symbols;

    public ExcludedAssetRegistry() {
        this(Set.of(), Set.of());
    }

    public ExcludedAssetRegistry(Collection<String> extraMints, Collection<String> extraSymbols) {
        Set<String> m = new HashSet<>(WELL_KNOWN_MINTS);
        if (extraMints != null) {
            extraMints.stream()
                    .filter(s -> s != null && !s.isBlank())
                    .map(String::strip)
                    .forEach(m::add);
        }
        this.mints = Set.copyOf(m);
        this.symbols = Stream.concat(WELL_KNOWN_SYMBOLS.stream(),
                        extraSymbols == null ? Stream.empty() : extraSymbols.stream())
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.strip().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Returns true if the given mint is a base/stable asset.
     */
    public boolean isExcludedMint(String mint) {
        if (mint == null || mint.isBlank()) {
            return false;
        }
        return mints.contains(mint.strip());
    }

    /**
     * Returns true if the given symbol (any case) is a base/stable asset symbol.
     */
    public boolean isExcludedSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return false;
        }
        return symbols.contains(symbol.strip().toUpperCase(Locale.ROOT));
    }
}
