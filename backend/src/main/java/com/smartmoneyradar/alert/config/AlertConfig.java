package com.smartmoneyradar.alert.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({ AlertProperties.class, ReportProperties.class })
public class AlertConfig {
}
