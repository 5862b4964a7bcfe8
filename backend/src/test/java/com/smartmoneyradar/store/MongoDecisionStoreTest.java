package com.smartmoneyradar.store;

import com.smartmoneyradar.domain.AlertRecord;
import com.smartmoneyradar.domain.AlertRecordRepository;
import com.smartmoneyradar.domain.PurchaseEventRecordRepository;
import com.smartmoneyradar.domain.TokenEvaluation;
import com.smartmoneyradar.domain.TokenEvaluationRepository;
import com.smartmoneyradar.domain.TradeSignal;
import com.smartmoneyradar.domain.TradeSignalRepository;
import com.smartmoneyradar.domain.ValuationOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoDecisionStoreTest {

    private static final String MINT = "7GCihgDB8fe6KNjn2MYtkzZcRjQy3t9GHdC8uHYmW2hr";
    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    private AlertRecordRepository alertRecordRepository;
    @Mock
    private TokenEvaluationRepository tokenEvaluationRepository;
    @Mock
    private PurchaseEventRecordRepository purchaseEventRecordRepository;
    @Mock
    private TradeSignalRepository tradeSignalRepository;

    private MongoDecisionStore store;

    @BeforeEach
    void setUp() {
        store = new MongoDecisionStore(alertRecordRepository, tokenEvaluationRepository,
                purchaseEventRecordRepository, tradeSignalRepository);
    }

    private static TradeSignal signal() {
        TradeSignal s = new TradeSignal();
        s.setAssetMint(MINT);
        s.setTrigger(TradeSignal.Trigger.WALLET_CLUSTER);
        s.setCreatedAt(T0);
        return s;
    }

    private static AlertRecord alert(Instant createdAt, long valuation) {
        AlertRecord a = new AlertRecord();
        a.setAssetMint(MINT);
        a.setSymbol("TKN");
        a.setAlertValuationUsd(BigDecimal.valueOf(valuation));
        a.setWalletCount(3);
        a.setCreatedAt(createdAt);
        return a;
    }

    private static TokenEvaluation evaluation(Instant alertTime, long alertValuation, long peak,
                                              ValuationOutcome outcome) {
        TokenEvaluation e = new TokenEvaluation();
        e.setAssetMint(MINT);
        e.setAlertTime(alertTime);
        e.setAlertValuationUsd(BigDecimal.valueOf(alertValuation));
        e.setPeakValuationUsd(BigDecimal.valueOf(peak));
        e.setClassification(outcome);
        return e;
    }

    @Test
    @DisplayName("trade signal: duplicate lookup covers live statuses since createdAt minus cooldown")
    void recordTradeSignal_liveSignalInCooldown_skipped() {
        when(tradeSignalRepository.existsByAssetMintAndStatusInAndCreatedAtAfter(
                MINT, TradeSignal.Status.LIVE, T0.minusSeconds(300))).thenReturn(true);

        assertThat(store.recordTradeSignal(signal(), Duration.ofSeconds(300))).isFalse();

        verify(tradeSignalRepository, never()).save(any());
    }

    @Test
    void recordTradeSignal_noLiveSignal_saved() {
        when(tradeSignalRepository.existsByAssetMintAndStatusInAndCreatedAtAfter(eq(MINT), any(), any()))
                .thenReturn(false);

        assertThat(store.recordTradeSignal(signal(), Duration.ofSeconds(300))).isTrue();

        verify(tradeSignalRepository).save(any(TradeSignal.class));
    }

    @Test
    void recordTradeSignal_persistenceFailure_returnsFalse() {
        when(tradeSignalRepository.existsByAssetMintAndStatusInAndCreatedAtAfter(eq(MINT), any(), any()))
                .thenThrow(new IllegalStateException("mongo down"));

        assertThat(store.recordTradeSignal(signal(), Duration.ofSeconds(300))).isFalse();
    }

    @Test
    @DisplayName("each alert takes the evaluation closest in time; evaluations are loaded once per asset")
    void findAlertsBetween_joinsClosestEvaluation() {
        Instant to = T0.plusSeconds(86_400);
        when(alertRecordRepository.findByCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByCreatedAtAsc(T0, to))
                .thenReturn(List.of(alert(T0.plusSeconds(100), 100_000), alert(T0.plusSeconds(5_000), 0)));
        when(tokenEvaluationRepository.findByAssetMint(MINT)).thenReturn(List.of(
                evaluation(T0.plusSeconds(101), 100_000, 300_000, ValuationOutcome.SHORT_LIST),
                evaluation(T0.plusSeconds(4_990), 140_000, 150_000, null)));

        List<ReportedAlert> found = store.findAlertsBetween(T0, to);

        assertThat(found).hasSize(2);
        assertThat(found.get(0).classification()).isEqualTo(ValuationOutcome.SHORT_LIST);
        assertThat(found.get(0).peakValuationUsd()).isEqualByComparingTo("300000");
        assertThat(found.get(1).classification()).isNull();
        assertThat(found.get(1).alertValuationUsd()).isEqualByComparingTo("140000");
        verify(tokenEvaluationRepository, times(1)).findByAssetMint(MINT);
    }

    @Test
    void findAlertsBetween_withoutEvaluation_zeroPeakAndUnclassified() {
        when(alertRecordRepository.findByCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByCreatedAtAsc(any(), any()))
                .thenReturn(List.of(alert(T0, 0)));
        when(tokenEvaluationRepository.findByAssetMint(MINT)).thenReturn(List.of());

        ReportedAlert found = store.findAlertsBetween(T0, T0.plusSeconds(60)).get(0);

        assertThat(found.alertValuationUsd()).isEqualByComparingTo("0");
        assertThat(found.peakValuationUsd()).isEqualByComparingTo("0");
        assertThat(found.classification()).isNull();
    }
}
