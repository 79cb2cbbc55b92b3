package com.moneyflow.backend.service.stream;

import com.moneyflow.backend.config.StreamProperties;
import com.moneyflow.backend.model.Observation;
import com.moneyflow.backend.model.ProcessedSignal;
import com.moneyflow.backend.model.WindowStatistics;
import com.moneyflow.backend.service.MetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Real-time path: keeps a bounded rolling window per symbol and emits a
 * {@link ProcessedSignal} when a new tick deviates from recent history.
 * Ticks for the same symbol are serialized on that symbol's window; different symbols never contend.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StreamProcessor {

    public static final String NORMAL = "normal";
    public static final String WARNING = "warning";
    public static final String CRITICAL = "critical";

    private final StreamProperties properties;
    private final MetricsService metricsService;

    private final Map<String, SymbolWindow> windows = new ConcurrentHashMap<>();
    private final Map<String, Moments> statsCache = new ConcurrentHashMap<>();

    public record Moments(double mean, double std) {}

    public Optional<ProcessedSignal> processTick(String symbol, double value) {
        return processTick(symbol, value, null);
    }

    public Optional<ProcessedSignal> processTick(String symbol, double value, Instant timestamp) {
        String key = Observation.normalizeSymbol(symbol);
        if (key.isEmpty() || !Double.isFinite(value)) {
            log.debug("Ignoring tick symbol={} value={}", symbol, value);
            return Optional.empty();
        }
        Instant observedAt = timestamp != null ? timestamp : Instant.now();
        SymbolWindow window = windows.computeIfAbsent(key, ignored -> new SymbolWindow(properties.getWindowSize()));
        metricsService.recordTick(key);

        double zScore;
        int bufferSize;
        Moments moments;
        synchronized (window) {
            window.add(value);
            bufferSize = window.size();
            if (bufferSize < properties.getMinSamples()) {
                return Optional.empty();
            }
            moments = window.moments();
            statsCache.put(key, moments);
            zScore = moments.std() == 0.0 ? 0.0 : (value - moments.mean()) / moments.std();
        }

        if (Math.abs(zScore) <= properties.getZScoreThreshold()) {
            return Optional.empty();
        }
        double anomalyScore = anomalyScore(zScore);
        String signalType = classify(anomalyScore);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("buffer_size", bufferSize);
        metadata.put("mean", moments.mean());
        metadata.put("std", moments.std());
        metricsService.recordStreamSignal(signalType);
        log.debug("Stream anomaly symbol={} value={} z={} type={}", key, value, zScore, signalType);
        return Optional.of(new ProcessedSignal(key, observedAt, value, zScore, anomalyScore, signalType, metadata));
    }

    public Optional<WindowStatistics> getStatistics(String symbol) {
        SymbolWindow window = windows.get(Observation.normalizeSymbol(symbol));
        if (window == null) {
            return Optional.empty();
        }
        synchronized (window) {
            if (window.size() == 0) {
                return Optional.empty();
            }
            return Optional.of(window.statistics(Observation.normalizeSymbol(symbol)));
        }
    }

    public Optional<Moments> getCachedStatistics(String symbol) {
        return Optional.ofNullable(statsCache.get(Observation.normalizeSymbol(symbol)));
    }

    public int getBufferSize(String symbol) {
        SymbolWindow window = windows.get(Observation.normalizeSymbol(symbol));
        if (window == null) {
            return 0;
        }
        synchronized (window) {
            return window.size();
        }
    }

    public void clearBuffer(String symbol) {
        String key = Observation.normalizeSymbol(symbol);
        SymbolWindow window = windows.get(key);
        if (window == null) {
            return;
        }
        synchronized (window) {
            window.clear();
            statsCache.remove(key);
        }
        log.info("Cleared buffer for {}", key);
    }

    static double anomalyScore(double zScore) {
        double absZ = Math.abs(zScore);
        if (absZ < 2) {
            return 0;
        }
        if (absZ < 3) {
            return 50;
        }
        if (absZ < 4) {
            return 75;
        }
        return 100;
    }

    static String classify(double anomalyScore) {
        if (anomalyScore >= 75) {
            return CRITICAL;
        }
        if (anomalyScore >= 50) {
            return WARNING;
        }
        return NORMAL;
    }

    private static final class SymbolWindow {

        private final int capacity;
        private final ArrayDeque<Double> values;

        private SymbolWindow(int capacity) {
            this.capacity = capacity;
            this.values = new ArrayDeque<>(capacity);
        }

        void add(double value) {
            if (values.size() == capacity) {
                values.pollFirst();
            }
            values.addLast(value);
        }

        int size() {
            return values.size();
        }

        void clear() {
            values.clear();
        }

        Moments moments() {
            double sum = 0.0;
            for (double v : values) {
                sum += v;
            }
            double mean = sum / values.size();
            double squares = 0.0;
            for (double v : values) {
                double diff = v - mean;
                squares += diff * diff;
            }
            // population deviation over the window
            return new Moments(mean, Math.sqrt(squares / values.size()));
        }

        WindowStatistics statistics(String symbol) {
            Moments moments = moments();
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double v : values) {
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            double first = values.peekFirst();
            double current = values.peekLast();
            double changePct = first != 0.0 ? (current - first) / first * 100.0 : 0.0;
            return new WindowStatistics(symbol, values.size(), moments.mean(), moments.std(), min, max, current, changePct);
        }
    }
}
