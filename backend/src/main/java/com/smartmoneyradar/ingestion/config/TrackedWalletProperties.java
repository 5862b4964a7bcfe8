package com.smartmoneyradar.ingestion.config;

import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Tracked smart-money wallets. Binding fails at startup when the list is empty.
 */
@ConfigurationProperties(prefix = "smartmoney.tracked-wallets")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class TrackedWalletProperties {

    /** Base58 wallet addresses. */
    @NotEmpty
    private List<String> addresses = new ArrayList<>();
}
