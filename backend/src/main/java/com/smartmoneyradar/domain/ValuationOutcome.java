package com.smartmoneyradar.domain;

/**
 * Classification of a thresholded post-alert valuation check.
 */
public enum ValuationOutcome {
    /** Gained at least the 5-minute threshold. */
    SHORT_LIST("short_list"),
    /** Gained at least the 30-minute threshold. */
    CONTRACTS_CHECK("contracts_check"),
    /** Below the threshold but alive. */
    NOT_SHORT_LIST("not_short_list"),
    /** At or below the dead-asset valuation floor. */
    TRASH("trash");

    private final String label;

    ValuationOutcome(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
