package com.smartmoneyradar.api.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Push receiver settings (smartmoney.webhook). A blank secret disables the Authorization check.
 */
@ConfigurationProperties(prefix = "smartmoney.webhook")
@NoArgsConstructor
@Getter
@Setter
public class WebhookProperties {

    private String secret = "";

    public boolean hasSecret() {
        return secret != null && !secret.isBlank();
    }

    @Configuration
    @EnableConfigurationProperties(WebhookProperties.class)
    static class Registration {
    }
}
