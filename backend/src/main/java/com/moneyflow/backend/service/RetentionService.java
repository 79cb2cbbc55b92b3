package com.moneyflow.backend.service;

import com.moneyflow.backend.config.StorageProperties;
import com.moneyflow.backend.repository.AlertRecordRepository;
import com.moneyflow.backend.repository.AnalyticsMetricRepository;
import com.moneyflow.backend.repository.MarketDataPointRepository;
import com.moneyflow.backend.repository.PredictionRepository;
import com.moneyflow.backend.repository.SignalRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.ToIntFunction;

/**
 * Deletes rows past the retention horizon. Each collection is cleaned in its own transaction.
 */
@Service
@Slf4j
public class RetentionService {

    private final StorageProperties storageProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Map<String, ToIntFunction<Instant>> collections = new LinkedHashMap<>();

    public RetentionService(StorageProperties storageProperties,
                            PlatformTransactionManager transactionManager,
                            Clock clock,
                            MarketDataPointRepository marketDataRepository,
                            SignalRecordRepository signalRepository,
                            AlertRecordRepository alertRepository,
                            PredictionRepository predictionRepository,
                            AnalyticsMetricRepository analyticsRepository) {
        this.storageProperties = storageProperties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        collections.put("market_data", marketDataRepository::deleteOlderThan);
        collections.put("signals", signalRepository::deleteOlderThan);
        collections.put("alerts", alertRepository::deleteOlderThan);
        collections.put("predictions", predictionRepository::deleteOlderThan);
        collections.put("analytics", analyticsRepository::deleteOlderThan);
    }

    public Map<String, Integer> cleanupOldData() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(storageProperties.getRetentionDays()));
        Map<String, Integer> deleted = new LinkedHashMap<>();
        collections.forEach((name, deleter) -> {
            try {
                Integer count = transactionTemplate.execute(status -> deleter.applyAsInt(cutoff));
                deleted.put(name, count == null ? 0 : count);
            } catch (RuntimeException e) {
                log.error("Retention cleanup failed for {}: {}", name, e.getMessage());
                deleted.put(name, 0);
            }
        });
        log.info("Retention cleanup before {} removed {}", cutoff, deleted);
        return deleted;
    }
}
