package com.smartmoneyradar.alert.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Daily closing report (smartmoney.report). The cron and zone are also read by @Scheduled.
 */
@ConfigurationProperties(prefix = "smartmoney.report")
@NoArgsConstructor
@Getter
@Setter
public class ReportProperties {

    private boolean enabled = true;

    private String cron = "0 0 0 * * *";

    /** Day boundaries for "yesterday". Default GMT+03:00. */
    private String zone = "GMT+03:00";
}
