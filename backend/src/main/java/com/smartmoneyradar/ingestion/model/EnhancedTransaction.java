package com.smartmoneyradar.ingestion.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Helius enhanced transaction, as returned by POST /v0/transactions and pushed by the webhook.
 * Only the fields the classifier and wallet matcher read are mapped; lists are never null.
 *
 * @param type      provider type tag, e.g. "SWAP", "TRANSFER", "NFT_SALE", "UNKNOWN"
 * @param source    provider source label, e.g. "JUPITER", "RAYDIUM"
 * @param timestamp block time in epoch seconds, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EnhancedTransaction(
        String signature,
        String type,
        String source,
        String feePayer,
        Long timestamp,
        List<TokenTransfer> tokenTransfers,
        List<NativeTransfer> nativeTransfers,
        List<ProgramInstruction> instructions,
        List<AccountDataEntry> accountData
) {

    public EnhancedTransaction {
        tokenTransfers = tokenTransfers == null ? List.of() : tokenTransfers;
        nativeTransfers = nativeTransfers == null ? List.of() : nativeTransfers;
        instructions = instructions == null ? List.of() : instructions;
        accountData = accountData == null ? List.of() : accountData;
    }
}
