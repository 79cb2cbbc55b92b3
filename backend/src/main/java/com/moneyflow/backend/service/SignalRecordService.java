package com.moneyflow.backend.service;

import com.moneyflow.backend.dto.SignalRecordDTO;
import com.moneyflow.backend.model.Signal;
import com.moneyflow.backend.model.SignalRecord;
import com.moneyflow.backend.model.SignalSeverity;
import com.moneyflow.backend.repository.SignalRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class SignalRecordService {

    public static final int DEFAULT_ACTIVE_LIMIT = 50;

    private final SignalRecordRepository repository;
    private final JsonCodec jsonCodec;
    private final Clock clock;

    @Transactional
    public Long create(Signal signal) {
        SignalRecord record = SignalRecord.builder()
                .scenario(signal.getScenario())
                .severity(signal.getSeverity())
                .confidence(signal.getConfidence())
                .triggers(jsonCodec.write(signal.getTriggers()))
                .recommendation(signal.getRecommendation())
                .metadata(jsonCodec.write(signal.getMetadata()))
                .active(true)
                .timestamp(signal.getTimestamp() != null ? signal.getTimestamp() : clock.instant())
                .build();
        Long id = repository.save(record).getId();
        log.debug("Stored signal {} as {}", signal.getScenario(), id);
        return id;
    }

    @Transactional(readOnly = true)
    public List<SignalRecordDTO> getActiveSignals(SignalSeverity severity, Integer limit) {
        int size = limit != null && limit > 0 ? limit : DEFAULT_ACTIVE_LIMIT;
        PageRequest page = PageRequest.of(0, size);
        List<SignalRecord> records = severity == null
                ? repository.findByActiveTrueOrderByTimestampDesc(page)
                : repository.findByActiveTrueAndSeverityOrderByTimestampDesc(severity, page);
        return records.stream().map(this::toDto).toList();
    }

    @Transactional
    public boolean deactivate(Long id) {
        return repository.findById(id)
                .map(record -> {
                    record.setActive(false);
                    record.setDeactivatedAt(clock.instant());
                    repository.save(record);
                    log.info("Deactivated signal {}", id);
                    return true;
                })
                .orElse(false);
    }

    private SignalRecordDTO toDto(SignalRecord record) {
        return SignalRecordDTO.builder()
                .id(record.getId())
                .scenario(record.getScenario())
                .severity(record.getSeverity().code())
                .confidence(record.getConfidence())
                .triggers(jsonCodec.readList(record.getTriggers()))
                .recommendation(record.getRecommendation())
                .metadata(jsonCodec.readMap(record.getMetadata()))
                .active(record.isActive())
                .timestamp(record.getTimestamp())
                .build();
    }
}
