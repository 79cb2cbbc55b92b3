package com.moneyflow.backend.controller;

import com.moneyflow.backend.exception.BadRequestException;
import com.moneyflow.backend.model.Alert;
import com.moneyflow.backend.model.AlertRecord;
import com.moneyflow.backend.service.AlertRecordService;
import com.moneyflow.backend.service.alert.AlertEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
@Validated
@Tag(name = "Alerts")
public class AlertController {

    private final AlertEngine alertEngine;
    private final AlertRecordService alertRecordService;
    private final Clock clock;

    @GetMapping("/recent")
    @Operation(summary = "Most recent alerts in the order they were raised")
    public ResponseEntity<List<Alert>> recent(@RequestParam(defaultValue = "10") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(alertEngine.getRecentAlerts(limit));
    }

    @GetMapping("/history")
    @Operation(summary = "Stored alerts, newest first; defaults to the last 24 hours")
    public ResponseEntity<List<AlertRecord>> history(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        Instant end = to != null ? to : clock.instant();
        Instant start = from != null ? from : end.minus(Duration.ofHours(24));
        if (start.isAfter(end)) {
            throw new BadRequestException("'from' must not be after 'to'");
        }
        return ResponseEntity.ok(alertRecordService.find(start, end, limit));
    }
}
