package com.moneyflow.backend.service;

import com.moneyflow.backend.model.AnalyticsMetric;
import com.moneyflow.backend.repository.AnalyticsMetricRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class AnalyticsService {

    public static final String RISK_SCORE = "risk_score";

    private final AnalyticsMetricRepository repository;
    private final JsonCodec jsonCodec;
    private final Clock clock;

    @Transactional
    public AnalyticsMetric record(String metricName, double value, Map<String, Object> metadata) {
        return repository.save(AnalyticsMetric.builder()
                .metricName(metricName)
                .value(value)
                .metadata(jsonCodec.write(metadata))
                .timestamp(clock.instant())
                .build());
    }

    @Transactional(readOnly = true)
    public List<AnalyticsMetric> getHistory(String metricName, int limit) {
        return repository.findByMetricNameOrderByTimestampDesc(metricName, PageRequest.of(0, Math.max(1, limit)));
    }
}
