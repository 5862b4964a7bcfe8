package com.smartmoneyradar.ingestion.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountDataEntry(
        String account,
        Long nativeBalanceChange
) {
}
