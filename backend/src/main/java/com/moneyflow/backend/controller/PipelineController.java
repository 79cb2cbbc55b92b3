package com.moneyflow.backend.controller;

import com.moneyflow.backend.dto.EvaluationResponse;
import com.moneyflow.backend.exception.NotFoundException;
import com.moneyflow.backend.service.MonitoringPipelineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
@Tag(name = "Pipeline")
public class PipelineController {

    private final MonitoringPipelineService pipelineService;

    @PostMapping("/evaluate")
    @Operation(summary = "Run an evaluation cycle against the current market snapshot")
    public ResponseEntity<EvaluationResponse> evaluate() {
        log.info("On-demand evaluation requested");
        return ResponseEntity.ok(toResponse(pipelineService.runEvaluationCycle()));
    }

    @GetMapping("/latest")
    @Operation(summary = "Result of the most recent evaluation cycle")
    public ResponseEntity<EvaluationResponse> latest() {
        return pipelineService.getLatestResult()
                .map(result -> ResponseEntity.ok(toResponse(result)))
                .orElseThrow(() -> new NotFoundException("No evaluation cycle has run yet"));
    }

    private EvaluationResponse toResponse(MonitoringPipelineService.EvaluationResult result) {
        return EvaluationResponse.builder()
                .evaluatedAt(result.evaluatedAt())
                .signals(result.signals())
                .alerts(result.alerts())
                .riskScore(result.riskScore())
                .build();
    }
}
