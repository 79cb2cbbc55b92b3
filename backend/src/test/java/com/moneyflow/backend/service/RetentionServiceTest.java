package com.moneyflow.backend.service;

import com.moneyflow.backend.config.StorageProperties;
import com.moneyflow.backend.repository.AlertRecordRepository;
import com.moneyflow.backend.repository.AnalyticsMetricRepository;
import com.moneyflow.backend.repository.MarketDataPointRepository;
import com.moneyflow.backend.repository.PredictionRepository;
import com.moneyflow.backend.repository.SignalRecordRepository;
import com.moneyflow.backend.support.FixedClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RetentionServiceTest {

    private final MarketDataPointRepository marketData = Mockito.mock(MarketDataPointRepository.class);
    private final SignalRecordRepository signals = Mockito.mock(SignalRecordRepository.class);
    private final AlertRecordRepository alerts = Mockito.mock(AlertRecordRepository.class);
    private final PredictionRepository predictions = Mockito.mock(PredictionRepository.class);
    private final AnalyticsMetricRepository analytics = Mockito.mock(AnalyticsMetricRepository.class);
    private final PlatformTransactionManager transactionManager = Mockito.mock(PlatformTransactionManager.class);

    private RetentionService retentionService;

    @BeforeEach
    void setUp() {
        when(transactionManager.getTransaction(any())).thenAnswer(inv -> new SimpleTransactionStatus());
        StorageProperties properties = new StorageProperties();
        properties.setRetentionDays(7);
        retentionService = new RetentionService(properties, transactionManager,
                Clock.fixed(FixedClockConfig.NOW, ZoneOffset.UTC),
                marketData, signals, alerts, predictions, analytics);
    }

    @Test
    void deletesEveryCollectionBeforeCutoff() {
        Instant cutoff = Instant.parse("2024-07-29T14:00:00Z");
        when(marketData.deleteOlderThan(cutoff)).thenReturn(120);
        when(signals.deleteOlderThan(cutoff)).thenReturn(4);
        when(alerts.deleteOlderThan(cutoff)).thenReturn(2);

        Map<String, Integer> deleted = retentionService.cleanupOldData();

        assertThat(deleted).containsExactly(
                Map.entry("market_data", 120),
                Map.entry("signals", 4),
                Map.entry("alerts", 2),
                Map.entry("predictions", 0),
                Map.entry("analytics", 0));
        verify(analytics).deleteOlderThan(cutoff);
    }

    @Test
    void failingCollectionReportsZeroAndOthersContinue() {
        when(signals.deleteOlderThan(any())).thenThrow(new DataAccessResourceFailureException("db gone"));
        when(analytics.deleteOlderThan(any())).thenReturn(9);

        Map<String, Integer> deleted = retentionService.cleanupOldData();

        assertThat(deleted).containsEntry("signals", 0).containsEntry("analytics", 9);
        verify(predictions).deleteOlderThan(any());
        verify(transactionManager).rollback(any());
    }
}
