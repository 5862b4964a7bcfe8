package com.smartmoneyradar.valuation.scheduler;

import com.smartmoneyradar.MutableClock;
import com.smartmoneyradar.domain.ValuationCheckEvent;
import com.smartmoneyradar.domain.ValuationOutcome;
import com.smartmoneyradar.store.DecisionStore;
import com.smartmoneyradar.valuation.config.ValuationProperties;
import com.smartmoneyradar.valuation.market.AssetSnapshot;
import com.smartmoneyradar.valuation.market.AssetSnapshotProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ValuationSchedulerTest {

    private static final String MINT = "7GCihgDB8fe6KNjn2MYtkzZcRjQy3t9GHdC8uHYmW2hr";
    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    private AssetSnapshotProvider snapshotProvider;
    @Mock
    private DecisionStore decisionStore;

    private MutableClock clock;
    private ValuationScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        scheduler = new ValuationScheduler(snapshotProvider, decisionStore, new ValuationProperties(), clock);
    }

    private static Optional<AssetSnapshot> valued(long usd) {
        return Optional.of(new AssetSnapshot("TKN", BigDecimal.valueOf(usd), BigDecimal.valueOf(40_000),
                BigDecimal.valueOf(90_000), 30, 30, BigDecimal.ONE));
    }

    @Test
    void schedule_queuesFourChecksAtFixedOffsets() {
        Instant alertTime = scheduler.schedule(MINT, "TKN", BigDecimal.valueOf(100_000), List.of("w1", "w2", "w3"));

        assertThat(alertTime).isEqualTo(T0);
        assertThat(scheduler.pendingCount()).isEqualTo(4);
        assertThat(scheduler.tick(T0.plusSeconds(59))).isEmpty();
    }

    @Test
    @DisplayName("offset-2 at 125k against a 100k alert is short-listed")
    void offset2_aboveThreshold_isShortList() {
        when(snapshotProvider.getAssetSnapshot(MINT)).thenReturn(valued(110_000), valued(125_000));
        scheduler.schedule(MINT, "TKN", BigDecimal.valueOf(100_000), List.of("w1"));

        List<ValuationCheckResult> first = scheduler.tick(T0.plusSeconds(60));
        List<ValuationCheckResult> second = scheduler.tick(T0.plusSeconds(300));

        assertThat(first).hasSize(1);
        assertThat(first.get(0).checkpoint()).isEqualTo(ValuationCheckpoint.OFFSET_1);
        assertThat(first.get(0).outcome()).isNull();
        assertThat(second).hasSize(1);
        ValuationCheckResult result = second.get(0);
        assertThat(result.checkpoint()).isEqualTo(ValuationCheckpoint.OFFSET_2);
        assertThat(result.change()).isCloseTo(0.25, within(1e-9));
        assertThat(result.outcome()).isEqualTo(ValuationOutcome.SHORT_LIST);
    }

    @Test
    void offset2_belowThreshold_isNotShortList() {
        when(snapshotProvider.getAssetSnapshot(MINT)).thenReturn(valued(115_000));
        scheduler.schedule(MINT, "TKN", BigDecimal.valueOf(100_000), List.of("w1"));

        List<ValuationCheckResult> results = scheduler.tick(T0.plusSeconds(300));

        assertThat(results).extracting(ValuationCheckResult::outcome)
                .containsExactly(null, ValuationOutcome.NOT_SHORT_LIST);
    }

    @Test
    @DisplayName("a thresholded check at or below the dead floor is trash")
    void deadValuation_isTrash() {
        when(snapshotProvider.getAssetSnapshot(MINT)).thenReturn(valued(15_000));
        scheduler.schedule(MINT, "TKN", BigDecimal.valueOf(100_000), List.of("w1"));

        List<ValuationCheckResult> results = scheduler.tick(T0.plusSeconds(1800));

        assertThat(results).hasSize(4);
        assertThat(results.get(1).outcome()).isEqualTo(ValuationOutcome.TRASH);
        assertThat(results.get(3).outcome()).isEqualTo(ValuationOutcome.TRASH);
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    void offset4_aboveHigherThreshold_isContractsCheck() {
        when(snapshotProvider.getAssetSnapshot(MINT)).thenReturn(valued(160_000));
        scheduler.schedule(MINT, "TKN", BigDecimal.valueOf(100_000), List.of("w1"));

        List<ValuationCheckResult> results = scheduler.tick(T0.plusSeconds(1800));

        assertThat(results.get(3).checkpoint()).isEqualTo(ValuationCheckpoint.OFFSET_4);
        assertThat(results.get(3).outcome()).isEqualTo(ValuationOutcome.CONTRACTS_CHECK);
    }

    @Test
    @DisplayName("the peak only rises, and an unknown snapshot counts as zero without lowering it")
    void peakIsMonotonic() {
        when(snapshotProvider.getAssetSnapshot(MINT))
                .thenReturn(valued(180_000), valued(120_000), Optional.empty(), valued(90_000));
        scheduler.schedule(MINT, "TKN", BigDecimal.valueOf(100_000), List.of("w1"));

        List<ValuationCheckResult> results = scheduler.tick(T0.plusSeconds(1800));

        assertThat(results).extracting(r -> r.peakValuationUsd().longValue())
                .containsExactly(180_000L, 180_000L, 180_000L, 180_000L);
        ValuationCheckResult unknown = results.get(2);
        assertThat(unknown.snapshotKnown()).isFalse();
        assertThat(unknown.valuationUsd()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(unknown.change()).isCloseTo(-1.0, within(1e-9));
        assertThat(scheduler.peakValuation(MINT, T0)).isEmpty();
    }

    @Test
    void everyCheck_isRecorded() {
        when(snapshotProvider.getAssetSnapshot(MINT)).thenReturn(valued(130_000));
        scheduler.schedule(MINT, "TKN", BigDecimal.valueOf(100_000), List.of("w1", "w2"));

        scheduler.tick(T0.plusSeconds(900));

        ArgumentCaptor<ValuationCheckEvent> captor = ArgumentCaptor.forClass(ValuationCheckEvent.class);
        verify(decisionStore, times(3)).recordValuationCheck(captor.capture());
        assertThat(captor.getAllValues()).extracting(ValuationCheckEvent::checkpoint)
                .containsExactly("offset-1", "offset-2", "offset-3");
        assertThat(captor.getAllValues().get(0).wallets()).containsExactly("w1", "w2");
        assertThat(scheduler.peakValuation(MINT, T0)).contains(BigDecimal.valueOf(130_000));
    }

    @Test
    void change_zeroBaseline_isZero() {
        assertThat(ValuationScheduler.change(BigDecimal.ZERO, BigDecimal.TEN)).isZero();
        assertThat(ValuationScheduler.change(BigDecimal.valueOf(200), BigDecimal.valueOf(100)))
                .isCloseTo(-0.5, within(1e-9));
    }
}
