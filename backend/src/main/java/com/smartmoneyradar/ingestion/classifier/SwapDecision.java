package com.smartmoneyradar.ingestion.classifier;

/**
 * Classification of one enhanced transaction. {@code reason} is empty for {@link Type#SWAP}.
 */
public record SwapDecision(Type type, String sourceLabel, String reason) {

    public enum Type {
        SWAP,
        TRANSFER,
        AIRDROP,
        NFT_ACTIVITY,
        UNCLASSIFIED
    }

    public static SwapDecision swap(String sourceLabel) {
        return new SwapDecision(Type.SWAP, sourceLabel, "");
    }

    public static SwapDecision rejected(Type type, String sourceLabel, String reason) {
        return new SwapDecision(type, sourceLabel, reason);
    }

    public boolean isSwap() {
        return type == Type.SWAP;
    }
}
