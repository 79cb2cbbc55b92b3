package com.moneyflow.backend.service;

import com.moneyflow.backend.model.Alert;
import com.moneyflow.backend.model.Anomaly;
import com.moneyflow.backend.model.MarketState;
import com.moneyflow.backend.model.Observation;
import com.moneyflow.backend.model.ProcessedSignal;
import com.moneyflow.backend.model.RiskScore;
import com.moneyflow.backend.model.Signal;
import com.moneyflow.backend.service.alert.AlertEngine;
import com.moneyflow.backend.service.anomaly.AnomalyDetector;
import com.moneyflow.backend.service.anomaly.ObservationTable;
import com.moneyflow.backend.service.risk.RiskScorer;
import com.moneyflow.backend.service.signal.SignalGenerator;
import com.moneyflow.backend.service.stream.StreamProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs observations through the real-time path and market snapshots through the
 * signal, risk and alert stages.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MonitoringPipelineService {

    private final StreamProcessor streamProcessor;
    private final AnomalyDetector anomalyDetector;
    private final SignalGenerator signalGenerator;
    private final RiskScorer riskScorer;
    private final AlertEngine alertEngine;
    private final MarketStateStore marketStateStore;
    private final MarketDataService marketDataService;
    private final SignalRecordService signalRecordService;
    private final AnalyticsService analyticsService;
    private final MetricsService metricsService;
    private final Clock clock;

    private final AtomicReference<EvaluationResult> latest = new AtomicReference<>();

    public record IngestResult(int accepted, int rejected, List<ProcessedSignal> processedSignals) {}

    public record EvaluationResult(Instant evaluatedAt, List<Signal> signals, List<Alert> alerts, RiskScore riskScore) {}

    public IngestResult ingest(List<Observation> observations) {
        if (observations == null || observations.isEmpty()) {
            return new IngestResult(0, 0, List.of());
        }
        List<Observation> valid = new ArrayList<>(observations.size());
        int rejected = 0;
        for (Observation observation : observations) {
            if (observation == null || !observation.isValid()) {
                rejected++;
                continue;
            }
            valid.add(observation.getTimestamp() == null
                    ? observation.toBuilder().timestamp(clock.instant()).build()
                    : observation);
        }
        metricsService.recordRejectedObservations(rejected);
        if (rejected > 0) {
            log.warn("Dropped {} invalid observations out of {}", rejected, observations.size());
        }

        try {
            marketDataService.saveAll(valid);
        } catch (RuntimeException e) {
            log.warn("Persisting {} observations failed, continuing with stream processing: {}", valid.size(), e.getMessage());
        }

        List<ProcessedSignal> processed = new ArrayList<>();
        for (Observation observation : valid) {
            streamProcessor.processTick(observation.getSymbol(), observation.getValue(), observation.getTimestamp())
                    .ifPresent(signal -> {
                        processed.add(signal);
                        if (StreamProcessor.CRITICAL.equals(signal.signalType())) {
                            log.warn("Critical tick on {}: value={} z={}", signal.symbol(), signal.value(), signal.zScore());
                        }
                    });
        }
        return new IngestResult(valid.size(), rejected, processed);
    }

    public EvaluationResult runEvaluationCycle() {
        MarketState state = marketStateStore.snapshot();
        List<Signal> signals = signalGenerator.generateSignals(state);
        RiskScore riskScore = riskScorer.calculateRiskScore(state);

        for (Signal signal : signals) {
            try {
                signalRecordService.create(signal);
            } catch (RuntimeException e) {
                log.warn("Could not persist signal {}: {}", signal.getScenario(), e.getMessage());
            }
        }
        try {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("level", riskScore.getLevel().name());
            metadata.put("components", riskScore.getComponents());
            analyticsService.record(AnalyticsService.RISK_SCORE, riskScore.getTotal(), metadata);
        } catch (RuntimeException e) {
            log.warn("Could not persist risk score: {}", e.getMessage());
        }

        List<Alert> alerts = alertEngine.evaluateAlerts(withRiskContext(signals, riskScore));
        EvaluationResult result = new EvaluationResult(clock.instant(), signals, alerts, riskScore);
        latest.set(result);
        log.info("Evaluation cycle: {} signals, {} alerts, risk {} ({})",
                signals.size(), alerts.size(), riskScore.getTotal(), riskScore.getLevel());
        return result;
    }

    public Optional<EvaluationResult> getLatestResult() {
        return Optional.ofNullable(latest.get());
    }

    /** Latest risk score, computed from the current snapshot when no cycle has run yet. */
    public RiskScore currentRiskScore() {
        EvaluationResult result = latest.get();
        if (result != null) {
            return result.riskScore();
        }
        return riskScorer.calculateRiskScore(marketStateStore.snapshot());
    }

    public List<Anomaly> detectAnomalies(Collection<String> symbols, Instant from, Instant to) {
        List<Observation> observations = marketDataService.findObservations(symbols, from, to);
        return anomalyDetector.detectAnomalies(ObservationTable.fromObservations(observations));
    }

    private List<Signal> withRiskContext(List<Signal> signals, RiskScore riskScore) {
        List<Signal> enriched = new ArrayList<>(signals.size());
        for (Signal signal : signals) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            if (signal.getMetadata() != null) {
                metadata.putAll(signal.getMetadata());
            }
            metadata.put("risk_level", riskScore.getLevel().name());
            metadata.put("risk_score", riskScore.getTotal());
            enriched.add(signal.toBuilder().metadata(metadata).build());
        }
        return enriched;
    }
}
