package com.moneyflow.backend.service;

import com.moneyflow.backend.model.Alert;
import com.moneyflow.backend.model.AlertRecord;
import com.moneyflow.backend.repository.AlertRecordRepository;
import com.moneyflow.backend.service.alert.AlertListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Persists every alert the engine records.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertRecordService implements AlertListener {

    private final AlertRecordRepository repository;
    private final JsonCodec jsonCodec;
    private final Clock clock;

    @Override
    @Transactional
    public void onAlert(Alert alert) {
        repository.save(AlertRecord.builder()
                .alertId(alert.getId())
                .severity(alert.getSeverity())
                .scenario(alert.getScenario())
                .confidence(alert.getConfidence())
                .message(alert.getMessage())
                .triggers(jsonCodec.write(alert.getTriggers()))
                .recommendation(alert.getRecommendation())
                .metadata(jsonCodec.write(alert.getMetadata()))
                .timestamp(parseTimestamp(alert.getTimestamp()))
                .build());
    }

    @Transactional(readOnly = true)
    public List<AlertRecord> find(Instant from, Instant to, int limit) {
        return repository.findByTimestampBetweenOrderByTimestampDesc(from, to, PageRequest.of(0, Math.max(1, limit)));
    }

    private Instant parseTimestamp(String timestamp) {
        if (timestamp == null) {
            return clock.instant();
        }
        try {
            return OffsetDateTime.parse(timestamp).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Alert timestamp {} not ISO-8601, using now", timestamp);
            return clock.instant();
        }
    }
}
