package com.smartmoneyradar.ingestion.classifier;

import java.util.Optional;

/**
 * Resolves the display name of a whitelisted swap-capable Solana program.
 * Used by the classifier to accept transactions whose provider type tag is not "SWAP".
 */
public interface DexProgramRegistry {

    /**
     * @param programId Solana program id (base58, case-sensitive)
     * @return DEX display name if whitelisted, e.g. "Raydium AMM V4", "Jupiter V6"
     */
    Optional<String> getDexName(String programId);
}
