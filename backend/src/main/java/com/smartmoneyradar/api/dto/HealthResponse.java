package com.smartmoneyradar.api.dto;

import java.util.Map;

public record HealthResponse(String status, int wallets, Map<String, Object> stats, String mode) {
}
