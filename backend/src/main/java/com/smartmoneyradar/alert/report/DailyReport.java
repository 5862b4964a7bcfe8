package com.smartmoneyradar.alert.report;

import com.smartmoneyradar.domain.ValuationOutcome;

import java.time.LocalDate;
import java.util.List;

/**
 * Closing summary of one local day's alerts, tokens ordered by peak change (best first, unknown last).
 */
public record DailyReport(LocalDate day, List<TokenSummary> tokens, int totalAlerts) {

    public DailyReport {
        tokens = List.copyOf(tokens);
    }

    public boolean isEmpty() {
        return totalAlerts == 0;
    }

    /** Tokens whose win/loss can be judged. */
    public List<TokenSummary> judged() {
        return tokens.stream().filter(TokenSummary::hasAlertValuation).toList();
    }

    public long wins() {
        return judged().stream().filter(TokenSummary::win).count();
    }

    public long losses() {
        return judged().size() - wins();
    }

    public long withoutAlertValuation() {
        return tokens.size() - judged().size();
    }

    public long trashCount() {
        return countClassified(ValuationOutcome.NOT_SHORT_LIST, ValuationOutcome.TRASH);
    }

    public long successCount() {
        return countClassified(ValuationOutcome.SHORT_LIST, ValuationOutcome.CONTRACTS_CHECK);
    }

    public long unevaluatedCount() {
        return tokens.stream().filter(t -> t.classification() == null).count();
    }

    private long countClassified(ValuationOutcome a, ValuationOutcome b) {
        return tokens.stream().filter(t -> t.classification() == a || t.classification() == b).count();
    }
}
