package com.smartmoneyradar.ingestion.filter;

import com.smartmoneyradar.ingestion.model.AccountDataEntry;
import com.smartmoneyradar.ingestion.model.EnhancedTransaction;
import com.smartmoneyradar.ingestion.model.NativeTransfer;
import com.smartmoneyradar.ingestion.model.TokenTransfer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Finds which tracked wallet a pushed transaction belongs to. Order: fee payer, token transfers (from, then to),
 * native transfers (from, then to), account data.
 */
@Component
@RequiredArgsConstructor
public class TrackedWalletMatcher {

    private final TrackedWallets trackedWallets;

    public Optional<String> findTrackedWallet(EnhancedTransaction tx) {
        if (trackedWallets.contains(tx.feePayer())) {
            return Optional.of(tx.feePayer());
        }
        for (TokenTransfer tt : tx.tokenTransfers()) {
            if (trackedWallets.contains(tt.fromUserAccount())) {
                return Optional.of(tt.fromUserAccount());
            }
            if (trackedWallets.contains(tt.toUserAccount())) {
                return Optional.of(tt.toUserAccount());
            }
        }
        for (NativeTransfer nt : tx.nativeTransfers()) {
            if (trackedWallets.contains(nt.fromUserAccount())) {
                return Optional.of(nt.fromUserAccount());
            }
            if (trackedWallets.contains(nt.toUserAccount())) {
                return Optional.of(nt.toUserAccount());
            }
        }
        for (AccountDataEntry ad : tx.accountData()) {
            if (trackedWallets.contains(ad.account())) {
                return Optional.of(ad.account());
            }
        }
        return Optional.empty();
    }
}
