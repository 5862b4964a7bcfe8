package com.smartmoneyradar.store;

import com.smartmoneyradar.domain.AlertRecord;
import com.smartmoneyradar.domain.PurchaseEventRecord;
import com.smartmoneyradar.domain.TradeSignal;
import com.smartmoneyradar.domain.ValuationCheckEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Best-effort sink for decisions. Implementations never throw: a failed write is logged and dropped so that
 * alerting never waits on persistence. A failed read yields an empty result.
 */
public interface DecisionStore {

    /** Stores the alert and flags the involved wallets' purchase events as early. */
    void recordAlert(AlertRecord alert);

    /** Appends the check to the alert's evaluation, raising its peak and updating its classification. */
    void recordValuationCheck(ValuationCheckEvent check);

    /** Stores the first accepted purchase of a wallet for an asset; later ones are ignored. */
    void recordPurchaseEvent(PurchaseEventRecord purchase);

    /**
     * Stores the signal unless a live signal for the same asset was created within {@code cooldown} before it.
     *
     * @return true when stored
     */
    boolean recordTradeSignal(TradeSignal signal, Duration cooldown);

    /** Alerts created in [from, to), oldest first, each joined with its closest evaluation. */
    List<ReportedAlert> findAlertsBetween(Instant from, Instant to);

    /**
     * Deletes alerts, evaluations and purchase events created before {@code cutoff}.
     *
     * @return removed count per collection
     */
    Map<String, Long> purgeOlderThan(Instant cutoff);
}
