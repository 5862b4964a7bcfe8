package com.smartmoneyradar.store;

import com.smartmoneyradar.domain.AlertRecord;
import com.smartmoneyradar.domain.AlertRecordRepository;
import com.smartmoneyradar.domain.PurchaseEventRecord;
import com.smartmoneyradar.domain.PurchaseEventRecordRepository;
import com.smartmoneyradar.domain.TokenEvaluation;
import com.smartmoneyradar.domain.TokenEvaluationRepository;
import com.smartmoneyradar.domain.TradeSignal;
import com.smartmoneyradar.domain.TradeSignalRepository;
import com.smartmoneyradar.domain.ValuationCheckEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MongoDB decision store. Every write catches and logs its own failure (persistence failure = WARN).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MongoDecisionStore implements DecisionStore {

    private final AlertRecordRepository alertRecordRepository;
    private final TokenEvaluationRepository tokenEvaluationRepository;
    private final PurchaseEventRecordRepository purchaseEventRecordRepository;
    private final TradeSignalRepository tradeSignalRepository;

    @Override
    public void recordAlert(AlertRecord alert) {
        try {
            if (alert.getCreatedAt() == null) {
                alert.setCreatedAt(Instant.now());
            }
            alertRecordRepository.save(alert);
            markEarlyBuyers(alert);
        } catch (Exception e) {
            log.warn("Persistence failure: alert for {} not recorded: {}", alert.getAssetMint(), e.getMessage());
        }
    }

    private void markEarlyBuyers(AlertRecord alert) {
        if (alert.getWallets() == null || alert.getWallets().isEmpty()) {
            return;
        }
        List<PurchaseEventRecord> purchases =
                purchaseEventRecordRepository.findByAssetMintAndWalletAddressIn(alert.getAssetMint(), alert.getWallets());
        for (PurchaseEventRecord p : purchases) {
            p.setEarly(true);
            p.setAlertValuationUsd(alert.getAlertValuationUsd());
        }
        if (!purchases.isEmpty()) {
            purchaseEventRecordRepository.saveAll(purchases);
        }
    }

    @Override
    public void recordValuationCheck(ValuationCheckEvent check) {
        try {
            TokenEvaluation evaluation = tokenEvaluationRepository
                    .findByAssetMintAndAlertTime(check.assetMint(), check.alertTime())
                    .orElseGet(() -> newEvaluation(check));
            BigDecimal peak = evaluation.getPeakValuationUsd();
            if (peak == null || (check.peakValuationUsd() != null && check.peakValuationUsd().compareTo(peak) > 0)) {
                evaluation.setPeakValuationUsd(check.peakValuationUsd());
            }
            if (check.outcome() != null) {
                evaluation.setClassification(check.outcome());
            }
            TokenEvaluation.Check entry = new TokenEvaluation.Check();
            entry.setCheckpoint(check.checkpoint());
            entry.setOffsetSeconds(check.offsetSeconds());
            entry.setValuationUsd(check.valuationUsd());
            entry.setChange(check.change());
            entry.setOutcome(check.outcome());
            entry.setCheckedAt(check.checkedAt());
            evaluation.getChecks().add(entry);
            evaluation.setUpdatedAt(check.checkedAt());
            tokenEvaluationRepository.save(evaluation);
        } catch (Exception e) {
            log.warn("Persistence failure: {} check for {} not recorded: {}",
                    check.checkpoint(), check.assetMint(), e.getMessage());
        }
    }

    private static TokenEvaluation newEvaluation(ValuationCheckEvent check) {
        TokenEvaluation evaluation = new TokenEvaluation();
        evaluation.setAssetMint(check.assetMint());
        evaluation.setSymbol(check.symbol());
        evaluation.setAlertValuationUsd(check.alertValuationUsd());
        evaluation.setAlertTime(check.alertTime());
        evaluation.setWallets(new ArrayList<>(check.wallets()));
        evaluation.setPeakValuationUsd(check.alertValuationUsd());
        evaluation.setCreatedAt(check.checkedAt());
        return evaluation;
    }

    @Override
    public void recordPurchaseEvent(PurchaseEventRecord purchase) {
        try {
            if (purchaseEventRecordRepository
                    .findByWalletAddressAndAssetMint(purchase.getWalletAddress(), purchase.getAssetMint())
                    .isPresent()) {
                return;
            }
            if (purchase.getCreatedAt() == null) {
                purchase.setCreatedAt(Instant.now());
            }
            purchaseEventRecordRepository.save(purchase);
        } catch (Exception e) {
            log.warn("Persistence failure: purchase {} of {} not recorded: {}",
                    purchase.getWalletAddress(), purchase.getAssetMint(), e.getMessage());
        }
    }

    @Override
    public boolean recordTradeSignal(TradeSignal signal, Duration cooldown) {
        try {
            if (signal.getCreatedAt() == null) {
                signal.setCreatedAt(Instant.now());
            }
            if (tradeSignalRepository.existsByAssetMintAndStatusInAndCreatedAtAfter(signal.getAssetMint(),
                    TradeSignal.Status.LIVE, signal.getCreatedAt().minus(cooldown))) {
                log.debug("Trade signal for {} skipped: live signal within {}s", signal.getAssetMint(),
                        cooldown.toSeconds());
                return false;
            }
            tradeSignalRepository.save(signal);
            log.info("Trade signal recorded: {} ({}) {}", signal.getSymbol(), signal.getAssetMint(), signal.getTrigger());
            return true;
        } catch (Exception e) {
            log.warn("Persistence failure: trade signal for {} not recorded: {}", signal.getAssetMint(), e.getMessage());
            return false;
        }
    }

    @Override
    public List<ReportedAlert> findAlertsBetween(Instant from, Instant to) {
        try {
            List<AlertRecord> alerts =
                    alertRecordRepository.findByCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByCreatedAtAsc(from, to);
            Map<String, List<TokenEvaluation>> evaluationsByAsset = new HashMap<>();
            List<ReportedAlert> result = new ArrayList<>(alerts.size());
            for (AlertRecord alert : alerts) {
                List<TokenEvaluation> evaluations = evaluationsByAsset.computeIfAbsent(alert.getAssetMint(),
                        tokenEvaluationRepository::findByAssetMint);
                result.add(join(alert, closest(evaluations, alert.getCreatedAt())));
            }
            return result;
        } catch (Exception e) {
            log.warn("Persistence failure: alerts between {} and {} not read: {}", from, to, e.getMessage());
            return List.of();
        }
    }

    static Optional<TokenEvaluation> closest(List<TokenEvaluation> evaluations, Instant alertAt) {
        return evaluations.stream()
                .filter(e -> e.getAlertTime() != null)
                .min(Comparator.comparing(e -> Duration.between(e.getAlertTime(), alertAt).abs()));
    }

    private static ReportedAlert join(AlertRecord alert, Optional<TokenEvaluation> evaluation) {
        BigDecimal alertValuation = alert.getAlertValuationUsd();
        if (alertValuation == null || alertValuation.signum() <= 0) {
            alertValuation = evaluation.map(TokenEvaluation::getAlertValuationUsd).orElse(null);
        }
        return new ReportedAlert(
                alert.getAssetMint(),
                alert.getSymbol(),
                alertValuation == null ? BigDecimal.ZERO : alertValuation,
                alert.getWalletCount(),
                alert.getCreatedAt(),
                evaluation.map(TokenEvaluation::getClassification).orElse(null),
                evaluation.map(TokenEvaluation::getPeakValuationUsd).orElse(BigDecimal.ZERO));
    }

    @Override
    public Map<String, Long> purgeOlderThan(Instant cutoff) {
        Map<String, Long> removed = new LinkedHashMap<>();
        try {
            removed.put("wallet_activity", purchaseEventRecordRepository.deleteByCreatedAtBefore(cutoff));
            removed.put("alerts", alertRecordRepository.deleteByCreatedAtBefore(cutoff));
            removed.put("token_evaluations", tokenEvaluationRepository.deleteByCreatedAtBefore(cutoff));
        } catch (Exception e) {
            log.warn("Persistence failure: retention cleanup incomplete: {}", e.getMessage());
        }
        return removed;
    }
}
