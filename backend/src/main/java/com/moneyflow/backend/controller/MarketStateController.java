package com.moneyflow.backend.controller;

import com.moneyflow.backend.exception.BadRequestException;
import com.moneyflow.backend.service.MarketStateStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/market-state")
@RequiredArgsConstructor
@Tag(name = "Market State")
public class MarketStateController {

    private final MarketStateStore marketStateStore;

    @PutMapping
    @Operation(summary = "Merge indicator values into the current market snapshot")
    public ResponseEntity<Map<String, Object>> merge(@RequestBody Map<String, Object> indicators) {
        if (indicators == null || indicators.isEmpty()) {
            throw new BadRequestException("At least one indicator is required");
        }
        return ResponseEntity.ok(marketStateStore.merge(indicators).asMap());
    }

    @GetMapping
    @Operation(summary = "Current market snapshot")
    public ResponseEntity<Map<String, Object>> current() {
        return ResponseEntity.ok(marketStateStore.snapshot().asMap());
    }
}
