package com.smartmoneyradar.ingestion.classifier;

import com.smartmoneyradar.ingestion.config.DexProgramProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-based DEX program whitelist. Built-in mainnet programs plus entries from
 * {@code smartmoney.ingestion.dex-programs.names}. Base58 ids are matched exactly.
 */
@Component
public class DefaultDexProgramRegistry implements DexProgramRegistry {

    private final Map<String, String> nameByProgramId = new ConcurrentHashMap<>();

    public DefaultDexProgramRegistry() {
        this(Map.of());
    }

    @Autowired
    public DefaultDexProgramRegistry(DexProgramProperties properties) {
        this(properties.getNames());
    }

    public DefaultDexProgramRegistry(Map<String, String> extra) {
        nameByProgramId.put("675kPX9MHTjS2zt1qfr1NYHuzeLXfQM9H24wFSdgbctX", "Raydium AMM V4");
        nameByProgramId.put("CAMMCzo5YL8w4VFF8KVHrK22GGUsp5VTaW7grrKgrWqK", "Raydium CLMM");
        nameByProgramId.put("CPMMoo8L3F4NbTegBCKVNunggL7H1ZpdTHKxQB5qKP1C", "Raydium CPMM");
        nameByProgramId.put("JUP6LkbZbjS1jKKwapdHNy74zcZ3tLUZoi5QNyVTaV4", "Jupiter V6");
        nameByProgramId.put("6EF8rrecthR5Dkzon8Nwu78hRvfCKubJ14M5uBEwF6P", "Pump.fun");
        nameByProgramId.put("pAMMBay6oceH9fJKBRHGP5D4bD4sWpmSwMn52FMfXEA", "PumpSwap");
        nameByProgramId.put("whirLbMiicVdio4qvUfM5KAg6Ct8VwpYzGff3uctyCc", "Orca Whirlpool");
        nameByProgramId.put("LBUZKhRxPF3XUpBCjp4YzTKgLccjZhTSDM9YuVaPwxo", "Meteora DLMM");
        if (extra != null) {
            extra.forEach((id, name) -> {
                if (id != null && !id.isBlank() && name != null && !name.isBlank()) {
                    nameByProgramId.put(id.strip(), name.strip());
                }
            });
        }
    }

    @Override
    public Optional<String> getDexName(String programId) {
        if (programId == null || programId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(nameByProgramId.get(programId.strip()));
    }
}
