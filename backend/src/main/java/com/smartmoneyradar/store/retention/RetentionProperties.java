package com.smartmoneyradar.store.retention;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Stored-decision retention (smartmoney.retention). The cron itself is read by @Scheduled.
 */
@ConfigurationProperties(prefix = "smartmoney.retention")
@NoArgsConstructor
@Getter
@Setter
public class RetentionProperties {

    private boolean enabled = true;

    /** Alerts, evaluations and purchase events older than this are deleted. Default 30. */
    private int days = 30;

    /** Default: daily at 04:00 UTC. */
    private String cron = "0 0 4 * * *";
}
