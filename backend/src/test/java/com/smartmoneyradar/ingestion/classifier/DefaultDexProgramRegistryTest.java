package com.smartmoneyradar.ingestion.classifier;

import com.smartmoneyradar.ingestion.config.DexProgramProperties;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultDexProgramRegistryTest {

    @Test
    void getDexName_builtInPrograms() {
        DefaultDexProgramRegistry registry = new DefaultDexProgramRegistry();
        assertThat(registry.getDexName("JUP6LkbZbjS1jKKwapdHNy74zcZ3tLUZoi5QNyVTaV4")).contains("Jupiter V6");
        assertThat(registry.getDexName("whirLbMiicVdio4qvUfM5KAg6Ct8VwpYzGff3uctyCc")).contains("Orca Whirlpool");
        assertThat(registry.getDexName("unknown")).isEmpty();
        assertThat(registry.getDexName(null)).isEmpty();
    }

    @Test
    void getDexName_configuredProgramsAreAdded() {
        DexProgramProperties props = new DexProgramProperties();
        props.setNames(Map.of("NewDex11111111111111111111111111111111111", "New DEX"));

        DefaultDexProgramRegistry registry = new DefaultDexProgramRegistry(props);

        assertThat(registry.getDexName("NewDex11111111111111111111111111111111111")).contains("New DEX");
        assertThat(registry.getDexName("LBUZKhRxPF3XUpBCjp4YzTKgLccjZhTSDM9YuVaPwxo")).contains("Meteora DLMM");
    }
}
