package com.smartmoneyradar.alert.notify;

import com.smartmoneyradar.alert.engine.AlertDecision;
import com.smartmoneyradar.alert.report.DailyReport;

/**
 * Delivers raised alerts and daily reports to an operator channel. Delivery is attempted once.
 */
public interface AlertNotifier {

    /**
     * @return false when delivery failed; the failure is already logged
     */
    boolean notify(AlertDecision decision);

    boolean notifyReport(DailyReport report);
}
