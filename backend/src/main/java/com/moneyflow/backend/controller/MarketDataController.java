package com.moneyflow.backend.controller;

import com.moneyflow.backend.dto.IngestResponse;
import com.moneyflow.backend.dto.MarketDataPointDTO;
import com.moneyflow.backend.dto.TickRequest;
import com.moneyflow.backend.exception.NotFoundException;
import com.moneyflow.backend.model.WindowStatistics;
import com.moneyflow.backend.service.MarketDataService;
import com.moneyflow.backend.service.MonitoringPipelineService;
import com.moneyflow.backend.service.stream.StreamProcessor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/market-data")
@RequiredArgsConstructor
@Validated
@Tag(name = "Market Data")
public class MarketDataController {

    private final MonitoringPipelineService pipelineService;
    private final MarketDataService marketDataService;
    private final StreamProcessor streamProcessor;

    @PostMapping("/ticks")
    @Operation(summary = "Ingest a batch of market ticks")
    public ResponseEntity<IngestResponse> ingest(@RequestBody List<@Valid TickRequest> ticks) {
        MonitoringPipelineService.IngestResult result = pipelineService.ingest(
                ticks.stream().map(TickRequest::toObservation).toList());
        return ResponseEntity.ok(IngestResponse.builder()
                .accepted(result.accepted())
                .rejected(result.rejected())
                .processedSignals(result.processedSignals())
                .build());
    }

    @GetMapping("/{symbol}")
    @Operation(summary = "Stored history for a symbol, oldest first")
    public ResponseEntity<List<MarketDataPointDTO>> history(
            @PathVariable String symbol,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) @Min(1) @Max(10000) Integer limit) {
        List<MarketDataPointDTO> points = marketDataService.find(symbol, from, to, limit)
                .stream()
                .map(marketDataService::toDto)
                .toList();
        return ResponseEntity.ok(points);
    }

    @GetMapping("/{symbol}/statistics")
    @Operation(summary = "Rolling window statistics for a symbol")
    public ResponseEntity<WindowStatistics> statistics(@PathVariable String symbol) {
        return streamProcessor.getStatistics(symbol)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NotFoundException("No stream data for symbol " + symbol));
    }
}
