package com.smartmoneyradar.common;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExcludedAssetRegistryTest {

    private static final String USDC = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";

    @Test
    void isExcludedMint_builtInBaseAssets() {
        ExcludedAssetRegistry registry = new ExcludedAssetRegistry();
        assertThat(registry.isExcludedMint(ExcludedAssetRegistry.WRAPPED_SOL_MINT)).isTrue();
        assertThat(registry.isExcludedMint(USDC)).isTrue();
        assertThat(registry.isExcludedMint("7GCihgDB8fe6KNjn2MYtkzZcRjQy3t9GHdC8uHYmW2hr")).isFalse();
        assertThat(registry.isExcludedMint(null)).isFalse();
    }

    @Test
    void isExcludedSymbol_caseInsensitive() {
        ExcludedAssetRegistry registry = new ExcludedAssetRegistry();
        assertThat(registry.isExcludedSymbol("usdc")).isTrue();
        assertThat(registry.isExcludedSymbol("JitoSOL")).isTrue();
        assertThat(registry.isExcludedSymbol("WIF")).isFalse();
    }

    @Test
    void extraEntries_areMergedWithBuiltIns() {
        ExcludedAssetRegistry registry = new ExcludedAssetRegistry(List.of(" MintX ", ""), List.of("wif"));
        assertThat(registry.isExcludedMint("MintX")).isTrue();
        assertThat(registry.isExcludedMint(USDC)).isTrue();
        assertThat(registry.isExcludedSymbol("WIF")).isTrue();
    }
}
