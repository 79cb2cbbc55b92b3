package com.moneyflow.backend.controller;

import com.moneyflow.backend.exception.BadRequestException;
import com.moneyflow.backend.model.Anomaly;
import com.moneyflow.backend.service.MonitoringPipelineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/anomalies")
@RequiredArgsConstructor
@Tag(name = "Anomalies")
public class AnomalyController {

    private final MonitoringPipelineService pipelineService;

    @GetMapping
    @Operation(summary = "Run batch anomaly detection over stored points")
    public ResponseEntity<List<Anomaly>> detect(
            @RequestParam List<String> symbols,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new BadRequestException("'from' must not be after 'to'");
        }
        return ResponseEntity.ok(pipelineService.detectAnomalies(symbols, from, to));
    }
}
