package com.moneyflow.backend.controller;

import com.moneyflow.backend.model.AnalyticsMetric;
import com.moneyflow.backend.model.RiskScore;
import com.moneyflow.backend.service.AnalyticsService;
import com.moneyflow.backend.service.MonitoringPipelineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/risk")
@RequiredArgsConstructor
@Validated
@Tag(name = "Risk")
public class RiskController {

    private final MonitoringPipelineService pipelineService;
    private final AnalyticsService analyticsService;

    @GetMapping("/score")
    @Operation(summary = "Latest composite risk score")
    public ResponseEntity<RiskScore> score() {
        return ResponseEntity.ok(pipelineService.currentRiskScore());
    }

    @GetMapping("/history")
    @Operation(summary = "Risk scores recorded by past evaluation cycles, newest first")
    public ResponseEntity<List<AnalyticsMetric>> history(@RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        return ResponseEntity.ok(analyticsService.getHistory(AnalyticsService.RISK_SCORE, limit));
    }
}
