package com.moneyflow.backend.controller;

import com.moneyflow.backend.dto.PredictionRequest;
import com.moneyflow.backend.exception.NotFoundException;
import com.moneyflow.backend.model.Prediction;
import com.moneyflow.backend.service.PredictionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Stores and serves model outputs produced outside this service.
 */
@RestController
@RequestMapping("/api/predictions")
@RequiredArgsConstructor
@Tag(name = "Predictions")
public class PredictionController {

    private final PredictionService predictionService;

    @PostMapping
    @Operation(summary = "Store a model prediction")
    public ResponseEntity<Map<String, Object>> create(@Valid @RequestBody PredictionRequest request) {
        Long id = predictionService.save(request.getModelType(), request.getDirection(),
                request.getConfidence(), request.getPayload());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", id));
    }

    @GetMapping("/latest")
    @Operation(summary = "Latest stored prediction, optionally for one model type")
    public ResponseEntity<Prediction> latest(@RequestParam(required = false) String modelType) {
        return predictionService.getLatest(modelType)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NotFoundException("No prediction stored"
                        + (modelType == null ? "" : " for model " + modelType)));
    }
}
