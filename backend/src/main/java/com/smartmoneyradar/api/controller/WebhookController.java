package com.smartmoneyradar.api.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartmoneyradar.api.config.WebhookProperties;
import com.smartmoneyradar.api.dto.ErrorBody;
import com.smartmoneyradar.api.dto.WebhookResponse;
import com.smartmoneyradar.config.AsyncConfig;
import com.smartmoneyradar.ingestion.filter.TrackedWalletMatcher;
import com.smartmoneyradar.ingestion.model.EnhancedTransaction;
import com.smartmoneyradar.ingestion.pipeline.MonitorStats;
import com.smartmoneyradar.ingestion.pipeline.SwapProcessingPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * POST /webhook: enhanced-transaction pushes, as a JSON array or a single object. Each record is matched to a
 * tracked wallet here and processed on webhook-executor; the response counts the queued records.
 */
@RestController
@Slf4j
public class WebhookController {

    private final SwapProcessingPipeline pipeline;
    private final TrackedWalletMatcher walletMatcher;
    private final WebhookProperties properties;
    private final MonitorStats monitorStats;
    private final ObjectMapper objectMapper;
    private final Executor executor;

    public WebhookController(SwapProcessingPipeline pipeline,
                             TrackedWalletMatcher walletMatcher,
                             WebhookProperties properties,
                             MonitorStats monitorStats,
                             ObjectMapper objectMapper,
                             @Qualifier(AsyncConfig.WEBHOOK_EXECUTOR) Executor executor) {
        this.pipeline = pipeline;
        this.walletMatcher = walletMatcher;
        this.properties = properties;
        this.monitorStats = monitorStats;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    @PostMapping(path = "/webhook", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<?> receive(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) String body) {
        if (properties.hasSecret() && !properties.getSecret().equals(authorization)) {
            log.warn("Webhook rejected: bad Authorization header");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(ErrorBody.of("UNAUTHORIZED", "Missing or invalid Authorization header"));
        }
        JsonNode payload;
        try {
            payload = body == null || body.isBlank() ? null : objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("Webhook payload is not JSON: {}", e.getOriginalMessage());
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_JSON", "Body is not valid JSON"));
        }
        List<JsonNode> records = new ArrayList<>();
        if (payload != null && payload.isArray()) {
            payload.forEach(records::add);
        } else if (payload != null && payload.isObject()) {
            records.add(payload);
        } else {
            return ResponseEntity.badRequest()
                    .body(ErrorBody.of("UNEXPECTED_PAYLOAD", "Expected a JSON array or object"));
        }

        int processed = 0;
        for (JsonNode node : records) {
            Optional<EnhancedTransaction> tx = toTransaction(node);
            if (tx.isEmpty()) {
                continue;
            }
            Optional<String> wallet = walletMatcher.findTrackedWallet(tx.get());
            if (wallet.isEmpty()) {
                continue;
            }
            try {
                executor.execute(() -> processSafely(tx.get(), wallet.get()));
            } catch (RejectedExecutionException e) {
                log.warn("Webhook backlog full, {} of {} records queued", processed, records.size());
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                        .body(ErrorBody.of("BUSY", "Processing queue is full"));
            }
            processed++;
        }
        monitorStats.webhookTransactions(records.size());
        if (processed > 0) {
            log.info("Webhook: {}/{} records queued", processed, records.size());
        }
        return ResponseEntity.ok(new WebhookResponse(processed));
    }

    private Optional<EnhancedTransaction> toTransaction(JsonNode node) {
        try {
            return Optional.ofNullable(objectMapper.treeToValue(node, EnhancedTransaction.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Webhook record skipped, not an enhanced transaction: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void processSafely(EnhancedTransaction tx, String wallet) {
        try {
            pipeline.process(tx, wallet);
        } catch (RuntimeException e) {
            log.warn("Webhook record {} failed: {}", tx.signature(), e.getMessage(), e);
        }
    }
}
