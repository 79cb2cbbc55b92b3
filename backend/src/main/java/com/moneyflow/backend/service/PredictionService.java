package com.moneyflow.backend.service;

import com.moneyflow.backend.model.Prediction;
import com.moneyflow.backend.repository.PredictionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class PredictionService {

    private final PredictionRepository repository;
    private final JsonCodec jsonCodec;
    private final Clock clock;

    @Transactional
    public Long save(String modelType, String direction, Double confidence, Map<String, Object> payload) {
        Prediction prediction = Prediction.builder()
                .modelType(modelType)
                .direction(direction)
                .confidence(confidence)
                .payload(jsonCodec.write(payload))
                .createdAt(clock.instant())
                .build();
        return repository.save(prediction).getId();
    }

    @Transactional(readOnly = true)
    public Optional<Prediction> getLatest(String modelType) {
        if (modelType == null || modelType.isBlank()) {
            return repository.findFirstByOrderByCreatedAtDesc();
        }
        return repository.findFirstByModelTypeOrderByCreatedAtDesc(modelType);
    }
}
