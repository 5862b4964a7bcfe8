package com.smartmoneyradar.ingestion.adapter;

import com.smartmoneyradar.ingestion.model.EnhancedTransaction;
import com.smartmoneyradar.ingestion.model.TransactionIdInfo;

import java.util.List;

/**
 * Chain-data provider used by the polling path. Implementations never throw; failures come back as
 * {@link CallResult#rateLimited} or {@link CallResult#failed}.
 */
public interface ChainDataProvider {

    /** Max signatures per enhanced-transactions request. */
    int MAX_ENHANCED_BATCH = 100;

    /**
     * Newest-first transaction ids of {@code wallet}, at most {@code limit}, stopping at {@code sinceId}
     * (exclusive) when given.
     */
    CallResult<List<TransactionIdInfo>> getLatestTransactionIds(String wallet, int limit, String sinceId);

    /**
     * Enhanced records for up to {@link #MAX_ENHANCED_BATCH} ids. Ids the provider does not know are omitted.
     */
    CallResult<List<EnhancedTransaction>> getEnhancedTransactions(List<String> ids);
}
