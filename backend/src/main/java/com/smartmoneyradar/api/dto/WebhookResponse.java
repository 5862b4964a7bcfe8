package com.smartmoneyradar.api.dto;

/**
 * @param processed delivered records that matched a tracked wallet and were queued
 */
public record WebhookResponse(int processed) {
}
