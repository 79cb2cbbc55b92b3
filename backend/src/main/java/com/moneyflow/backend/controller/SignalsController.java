package com.moneyflow.backend.controller;

import com.moneyflow.backend.dto.SignalRecordDTO;
import com.moneyflow.backend.exception.NotFoundException;
import com.moneyflow.backend.model.SignalSeverity;
import com.moneyflow.backend.service.SignalRecordService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/signals")
@RequiredArgsConstructor
@Validated
@Tag(name = "Signals")
public class SignalsController {

    private final SignalRecordService signalRecordService;

    @GetMapping("/active")
    @Operation(summary = "Active signals, newest first")
    public ResponseEntity<List<SignalRecordDTO>> active(
            @RequestParam(required = false) String severity,
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        SignalSeverity filter = severity == null || severity.isBlank() ? null : SignalSeverity.fromCode(severity);
        return ResponseEntity.ok(signalRecordService.getActiveSignals(filter, limit));
    }

    @PostMapping("/{id}/deactivate")
    @Operation(summary = "Deactivate a stored signal")
    public ResponseEntity<Map<String, Object>> deactivate(@PathVariable Long id) {
        if (!signalRecordService.deactivate(id)) {
            throw new NotFoundException("Signal " + id + " not found");
        }
        return ResponseEntity.ok(Map.of("id", id, "active", false));
    }
}
