package com.smartmoneyradar.ingestion.classifier;

import com.smartmoneyradar.common.ExcludedAssetRegistry;
import com.smartmoneyradar.ingestion.model.EnhancedTransaction;
import com.smartmoneyradar.ingestion.model.NativeTransfer;
import com.smartmoneyradar.ingestion.model.ProgramInstruction;
import com.smartmoneyradar.ingestion.model.TokenTransfer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies Helius enhanced transactions and extracts the purchase a tracked wallet made.
 * <ol>
 *   <li>type "SWAP": accepted with the provider source label;</li>
 *   <li>type "TRANSFER": more than {@value #AIRDROP_MIN_RECIPIENTS} distinct recipients is an airdrop, else a transfer;</li>
 *   <li>type containing "NFT": NFT activity;</li>
 *   <li>otherwise: top-level instructions, then inner instructions, are scanned for a whitelisted DEX program.</li>
 * </ol>
 */
@Component
@RequiredArgsConstructor
public class SwapClassifier {

    /** Fan-out above which a TRANSFER is a batch distribution. */
    static final int AIRDROP_MIN_RECIPIENTS = 5;

    private static final BigDecimal LAMPORTS_PER_SOL = BigDecimal.valueOf(1_000_000_000L);
    private static final String UNKNOWN = "UNKNOWN";

    private final DexProgramRegistry dexProgramRegistry;
    private final ExcludedAssetRegistry excludedAssetRegistry;

    public SwapDecision classify(EnhancedTransaction tx) {
        String type = tx.type() == null ? UNKNOWN : tx.type();
        String source = tx.source() == null ? UNKNOWN : tx.source();

        if ("SWAP".equals(type)) {
            return SwapDecision.swap(source);
        }
        if ("TRANSFER".equals(type)) {
            Set<String> recipients = new HashSet<>();
            for (TokenTransfer tt : tx.tokenTransfers()) {
                if (tt.toUserAccount() != null && !tt.toUserAccount().isEmpty()) {
                    recipients.add(tt.toUserAccount());
                }
            }
            if (recipients.size() > AIRDROP_MIN_RECIPIENTS) {
                return SwapDecision.rejected(SwapDecision.Type.AIRDROP, source,
                        "Batch transfer: " + recipients.size() + " distinct recipients");
            }
            return SwapDecision.rejected(SwapDecision.Type.TRANSFER, source, "Transfer, not a swap");
        }
        if (type.contains("NFT")) {
            return SwapDecision.rejected(SwapDecision.Type.NFT_ACTIVITY, source, "NFT activity (" + type + ")");
        }

        for (ProgramInstruction ix : tx.instructions()) {
            Optional<String> dex = dexProgramRegistry.getDexName(ix.programId());
            if (dex.isPresent()) {
                return SwapDecision.swap(dex.get());
            }
        }
        for (ProgramInstruction ix : tx.instructions()) {
            for (ProgramInstruction inner : ix.innerInstructions()) {
                Optional<String> dex = dexProgramRegistry.getDexName(inner.programId());
                if (dex.isPresent()) {
                    return SwapDecision.swap(dex.get());
                }
            }
        }
        return SwapDecision.rejected(SwapDecision.Type.UNCLASSIFIED, source,
                "No DEX program id found (type: " + type + ")");
    }

    /**
     * Extracts what {@code wallet} bought in {@code tx}: the first non-excluded token it received and the SOL it spent.
     */
    public SwapExtraction extractSwap(EnhancedTransaction tx, String wallet) {
        SwapDecision decision = classify(tx);
        if (!decision.isSwap()) {
            return SwapExtraction.rejected(decision.reason());
        }
        String target = wallet.toLowerCase(Locale.ROOT);

        TokenTransfer received = null;
        for (TokenTransfer tt : tx.tokenTransfers()) {
            if (!equalsWallet(tt.toUserAccount(), target)) {
                continue;
            }
            if (excludedAssetRegistry.isExcludedMint(tt.mint())) {
                continue;
            }
            received = tt;
            break;
        }
        if (received == null) {
            return SwapExtraction.rejected("No token received by this wallet");
        }

        BigDecimal nativeSpent = nativeSpent(tx, target);
        if (nativeSpent.signum() == 0) {
            nativeSpent = wrappedNativeSpent(tx, target);
        }
        return SwapExtraction.valid(new SwapDetails(received.mint(), received.amountOrZero(), nativeSpent,
                decision.sourceLabel()));
    }

    private static BigDecimal nativeSpent(EnhancedTransaction tx, String target) {
        long lamports = 0L;
        for (NativeTransfer nt : tx.nativeTransfers()) {
            if (equalsWallet(nt.fromUserAccount(), target)) {
                lamports += nt.lamports();
            }
            if (equalsWallet(nt.toUserAccount(), target)) {
                lamports -= nt.lamports();
            }
        }
        if (lamports <= 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(lamports).divide(LAMPORTS_PER_SOL, 9, RoundingMode.DOWN);
    }

    /** Pump.fun / PumpSwap route the spend through wSOL token transfers instead of native ones. */
    private static BigDecimal wrappedNativeSpent(EnhancedTransaction tx, String target) {
        BigDecimal spent = BigDecimal.ZERO;
        for (TokenTransfer tt : tx.tokenTransfers()) {
            if (!ExcludedAssetRegistry.WRAPPED_SOL_MINT.equals(tt.mint())) {
                continue;
            }
            if (equalsWallet(tt.fromUserAccount(), target)) {
                spent = spent.add(tt.amountOrZero());
            }
            if (equalsWallet(tt.toUserAccount(), target)) {
                spent = spent.subtract(tt.amountOrZero());
            }
        }
        return spent.signum() > 0 ? spent : BigDecimal.ZERO;
    }

    private static boolean equalsWallet(String account, String lowerCaseWallet) {
        return account != null && account.toLowerCase(Locale.ROOT).equals(lowerCaseWallet);
    }
}
