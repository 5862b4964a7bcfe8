package com.smartmoneyradar.store;

import com.smartmoneyradar.config.MongoConfig;
import com.smartmoneyradar.domain.AlertRecord;
import com.smartmoneyradar.domain.AlertRecordRepository;
import com.smartmoneyradar.domain.PurchaseEventRecord;
import com.smartmoneyradar.domain.PurchaseEventRecordRepository;
import com.smartmoneyradar.domain.TokenEvaluation;
import com.smartmoneyradar.domain.TokenEvaluationRepository;
import com.smartmoneyradar.domain.TradeSignal;
import com.smartmoneyradar.domain.TradeSignalRepository;
import com.smartmoneyradar.domain.ValuationCheckEvent;
import com.smartmoneyradar.domain.ValuationOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DataMongoTest
@Testcontainers(disabledWithoutDocker = true)
@Import({ MongoConfig.class, MongoDecisionStore.class, MongoCheckpointStore.class })
class MongoDecisionStoreIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    private static final String MINT = "7GCihgDB8fe6KNjn2MYtkzZcRjQy3t9GHdC8uHYmW2hr";
    private static final Instant ALERT_TIME = Instant.parse("2025-03-01T12:00:00Z");

    @Autowired
    DecisionStore store;
    @Autowired
    CheckpointStore checkpointStore;
    @Autowired
    AlertRecordRepository alertRepository;
    @Autowired
    TokenEvaluationRepository evaluationRepository;
    @Autowired
    PurchaseEventRecordRepository purchaseRepository;
    @Autowired
    TradeSignalRepository signalRepository;

    @BeforeEach
    void clean() {
        alertRepository.deleteAll();
        evaluationRepository.deleteAll();
        purchaseRepository.deleteAll();
        signalRepository.deleteAll();
    }

    private static TradeSignal signal(Instant createdAt) {
        TradeSignal s = new TradeSignal();
        s.setAssetMint(MINT);
        s.setSymbol("TKN");
        s.setEntryValuationUsd(BigDecimal.valueOf(120_000));
        s.setTrigger(TradeSignal.Trigger.WALLET_CLUSTER);
        s.setWalletCount(3);
        s.setCreatedAt(createdAt);
        return s;
    }

    @Test
    @DisplayName("a second live signal for the asset inside the cooldown is skipped")
    void tradeSignal_duplicateWithinCooldown_skipped() {
        Duration cooldown = Duration.ofSeconds(300);

        assertThat(store.recordTradeSignal(signal(ALERT_TIME), cooldown)).isTrue();
        assertThat(store.recordTradeSignal(signal(ALERT_TIME.plusSeconds(120)), cooldown)).isFalse();
        assertThat(store.recordTradeSignal(signal(ALERT_TIME.plusSeconds(301)), cooldown)).isTrue();
        assertThat(signalRepository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("alerts in a range are joined with their closest evaluation")
    void findAlertsBetween_joinsClosestEvaluation() {
        AlertRecord alert = new AlertRecord();
        alert.setAssetMint(MINT);
        alert.setSymbol("TKN");
        alert.setAlertValuationUsd(BigDecimal.valueOf(100_000));
        alert.setWalletCount(3);
        alert.setCreatedAt(ALERT_TIME);
        alertRepository.save(alert);

        TokenEvaluation near = new TokenEvaluation();
        near.setAssetMint(MINT);
        near.setAlertTime(ALERT_TIME.plusSeconds(1));
        near.setPeakValuationUsd(BigDecimal.valueOf(250_000));
        near.setClassification(ValuationOutcome.SHORT_LIST);
        near.setCreatedAt(ALERT_TIME);
        TokenEvaluation far = new TokenEvaluation();
        far.setAssetMint(MINT);
        far.setAlertTime(ALERT_TIME.minusSeconds(7_200));
        far.setPeakValuationUsd(BigDecimal.valueOf(900_000));
        far.setClassification(ValuationOutcome.TRASH);
        far.setCreatedAt(ALERT_TIME.minusSeconds(7_200));
        evaluationRepository.saveAll(List.of(near, far));

        List<ReportedAlert> found = store.findAlertsBetween(ALERT_TIME.minusSeconds(60), ALERT_TIME.plusSeconds(60));

        assertThat(found).hasSize(1);
        assertThat(found.get(0).classification()).isEqualTo(ValuationOutcome.SHORT_LIST);
        assertThat(found.get(0).peakValuationUsd()).isEqualByComparingTo("250000");
        assertThat(store.findAlertsBetween(ALERT_TIME.plusSeconds(1), ALERT_TIME.plusSeconds(60))).isEmpty();
    }

    private static PurchaseEventRecord purchase(String wallet, String signature) {
        PurchaseEventRecord r = new PurchaseEventRecord();
        r.setWalletAddress(wallet);
        r.setAssetMint(MINT);
        r.setSymbol("TKN");
        r.setSignature(signature);
        r.setNativeSpent(new BigDecimal("0.75"));
        r.setValuationUsd(new BigDecimal("98000.55"));
        r.setCreatedAt(ALERT_TIME.minusSeconds(10));
        return r;
    }

    @Test
    @DisplayName("first purchase per wallet and asset is kept; the alert marks it early")
    void purchaseThenAlert_marksEarlyBuyers() {
        store.recordPurchaseEvent(purchase("w1", "s1"));
        store.recordPurchaseEvent(purchase("w1", "s2"));
        store.recordPurchaseEvent(purchase("w2", "s3"));

        AlertRecord alert = new AlertRecord();
        alert.setAssetMint(MINT);
        alert.setSymbol("TKN");
        alert.setAlertValuationUsd(new BigDecimal("120000.25"));
        alert.setBaselineValuationUsd(new BigDecimal("120000.25"));
        alert.setWalletCount(1);
        alert.setWallets(new ArrayList<>(List.of("w1")));
        alert.setStreakPosition(1);
        alert.setCreatedAt(ALERT_TIME);
        store.recordAlert(alert);

        PurchaseEventRecord w1 = purchaseRepository.findByWalletAddressAndAssetMint("w1", MINT).orElseThrow();
        PurchaseEventRecord w2 = purchaseRepository.findByWalletAddressAndAssetMint("w2", MINT).orElseThrow();
        assertThat(purchaseRepository.count()).isEqualTo(2);
        assertThat(w1.getSignature()).isEqualTo("s1");
        assertThat(w1.isEarly()).isTrue();
        assertThat(w1.getAlertValuationUsd()).isEqualByComparingTo("120000.25");
        assertThat(w1.getNativeSpent()).isEqualByComparingTo("0.75");
        assertThat(w2.isEarly()).isFalse();
        assertThat(alertRepository.findByAssetMintOrderByCreatedAtDesc(MINT)).hasSize(1);
    }

    private static ValuationCheckEvent check(String checkpoint, long valuation, ValuationOutcome outcome, long peak,
                                             int offset) {
        return new ValuationCheckEvent(MINT, "TKN", BigDecimal.valueOf(100_000), ALERT_TIME, List.of("w1", "w2"),
                checkpoint, offset, BigDecimal.valueOf(valuation), (valuation - 100_000) / 100_000.0, outcome,
                BigDecimal.valueOf(peak), ALERT_TIME.plusSeconds(offset));
    }

    @Test
    void valuationChecks_accumulateOnOneEvaluation() {
        store.recordValuationCheck(check("offset-1", 140_000, null, 140_000, 60));
        store.recordValuationCheck(check("offset-2", 125_000, ValuationOutcome.SHORT_LIST, 140_000, 300));

        TokenEvaluation evaluation = evaluationRepository.findByAssetMintAndAlertTime(MINT, ALERT_TIME).orElseThrow();
        assertThat(evaluation.getChecks()).extracting(TokenEvaluation.Check::getCheckpoint)
                .containsExactly("offset-1", "offset-2");
        assertThat(evaluation.getPeakValuationUsd()).isEqualByComparingTo("140000");
        assertThat(evaluation.getClassification()).isEqualTo(ValuationOutcome.SHORT_LIST);
        assertThat(evaluation.getWallets()).containsExactly("w1", "w2");
    }

    @Test
    void purgeOlderThan_removesOldDecisions() {
        store.recordPurchaseEvent(purchase("w1", "s1"));
        store.recordValuationCheck(check("offset-1", 110_000, null, 110_000, 60));

        Map<String, Long> removed = store.purgeOlderThan(ALERT_TIME.plusSeconds(3600));

        assertThat(removed).containsEntry("wallet_activity", 1L).containsEntry("token_evaluations", 1L);
        assertThat(purchaseRepository.count()).isZero();
    }

    @Test
    void checkpoints_roundTripAndUpdate() {
        checkpointStore.saveAll(Map.of("w1", "sigA", "w2", "sigB"));
        checkpointStore.saveAll(Map.of("w1", "sigC"));

        assertThat(checkpointStore.loadAll()).containsEntry("w1", "sigC").containsEntry("w2", "sigB");
    }
}
