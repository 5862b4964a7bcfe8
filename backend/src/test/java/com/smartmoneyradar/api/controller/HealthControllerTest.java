package com.smartmoneyradar.api.controller;

import com.smartmoneyradar.MutableClock;
import com.smartmoneyradar.alert.engine.AlertEngine;
import com.smartmoneyradar.ingestion.config.PollingProperties;
import com.smartmoneyradar.ingestion.config.TrackedWalletProperties;
import com.smartmoneyradar.ingestion.filter.AddressValidator;
import com.smartmoneyradar.ingestion.filter.TrackedWallets;
import com.smartmoneyradar.ingestion.pipeline.MonitorStats;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    @Mock
    private AlertEngine alertEngine;

    @Test
    void health_reportsWalletsStatsAndMode() {
        TrackedWalletProperties walletProps = new TrackedWalletProperties();
        walletProps.setAddresses(List.of("9WzDXwBbmkg8ZTbNMqUxvQRAyrZzDsGYdLVL9zYtAWWM",
                "5Q544fKrFoe6tsEbD7S8EmxGTJYAKtTVhAW5Q5pge4j1"));
        MonitorStats stats = new MonitorStats(new MutableClock(Instant.parse("2025-03-01T12:00:00Z")));
        stats.incrementCycles();
        PollingProperties polling = new PollingProperties();
        polling.setEnabled(false);
        when(alertEngine.fakeAlertsBlocked()).thenReturn(2L);
        HealthController controller = new HealthController(
                new TrackedWallets(walletProps, new AddressValidator()), stats, alertEngine, polling);

        WebTestClient.bindToController(controller).build()
                .get().uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ok")
                .jsonPath("$.wallets").isEqualTo(2)
                .jsonPath("$.stats.cycles").isEqualTo(1)
                .jsonPath("$.stats.fakeAlertsBlocked").isEqualTo(2)
                .jsonPath("$.mode").isEqualTo("webhook");
    }
}
