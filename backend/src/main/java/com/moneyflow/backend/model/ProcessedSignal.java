package com.moneyflow.backend.model;

import java.time.Instant;
import java.util.Map;

/**
 * Tick-level anomaly emitted by the stream processor.
 *
 * @param signalType one of {@code normal}, {@code warning}, {@code critical}
 */
public record ProcessedSignal(
        String symbol,
        Instant timestamp,
        double value,
        double zScore,
        double anomalyScore,
        String signalType,
        Map<String, Object> metadata
) {
}
