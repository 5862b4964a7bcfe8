package com.smartmoneyradar.valuation.scheduler;

import com.smartmoneyradar.domain.ValuationOutcome;

import java.time.Duration;

/**
 * The four post-alert checks. offset-2 and offset-4 carry a gain threshold; offset-1 and offset-3 only observe.
 */
public enum ValuationCheckpoint {
    OFFSET_1("offset-1", Duration.ofSeconds(60), null),
    OFFSET_2("offset-2", Duration.ofSeconds(300), ValuationOutcome.SHORT_LIST),
    OFFSET_3("offset-3", Duration.ofSeconds(900), null),
    OFFSET_4("offset-4", Duration.ofSeconds(1800), ValuationOutcome.CONTRACTS_CHECK);

    private final String label;
    private final Duration offset;
    private final ValuationOutcome passOutcome;

    ValuationCheckpoint(String label, Duration offset, ValuationOutcome passOutcome) {
        this.label = label;
        this.offset = offset;
        this.passOutcome = passOutcome;
    }

    public String label() {
        return label;
    }

    public Duration offset() {
        return offset;
    }

    /** Outcome when the gain meets the threshold; null for observation-only checks. */
    public ValuationOutcome passOutcome() {
        return passOutcome;
    }

    public boolean isThresholded() {
        return passOutcome != null;
    }
}
