package com.smartmoneyradar.alert.job;

import com.smartmoneyradar.alert.config.ReportProperties;
import com.smartmoneyradar.alert.notify.AlertNotifier;
import com.smartmoneyradar.alert.report.DailyReport;
import com.smartmoneyradar.alert.report.DailyReportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Sends yesterday's closing report at local midnight.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DailyReportJob {

    private final DailyReportService reportService;
    private final AlertNotifier alertNotifier;
    private final ReportProperties properties;

    @Scheduled(cron = "${smartmoney.report.cron:0 0 0 * * *}", zone = "${smartmoney.report.zone:GMT+03:00}")
    public void runScheduled() {
        if (!properties.isEnabled()) {
            return;
        }
        try {
            DailyReport report = reportService.build(reportService.previousDay());
            if (!alertNotifier.notifyReport(report)) {
                log.warn("Daily report for {} not delivered", report.day());
            }
        } catch (RuntimeException e) {
            log.warn("Daily report failed: {}", e.getMessage(), e);
        }
    }
}
