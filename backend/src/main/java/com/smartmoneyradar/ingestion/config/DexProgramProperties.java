package com.smartmoneyradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Extra whitelisted DEX programs on top of the built-in ones. Key = program id (base58), value = display name.
 */
@ConfigurationProperties(prefix = "smartmoney.ingestion.dex-programs")
@NoArgsConstructor
@Getter
@Setter
public class DexProgramProperties {

    private Map<String, String> names = new HashMap<>();
}
