package com.smartmoneyradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Extra mints and symbols never treated as smart-money purchases (added to wSOL, stablecoins, LSTs).
 */
@ConfigurationProperties(prefix = "smartmoney.exclusions")
@NoArgsConstructor
@Getter
@Setter
public class ExclusionProperties {

    private List<String> mints = new ArrayList<>();

    private List<String> symbols = new ArrayList<>();
}
