package com.moneyflow.backend.service;

import com.moneyflow.backend.config.SchedulerProperties;
import com.moneyflow.backend.model.Observation;
import com.moneyflow.backend.service.collector.MarketDataCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "moneyflow.scheduler", name = "enabled", havingValue = "true")
public class PipelineScheduler {

    private final MonitoringPipelineService pipelineService;
    private final RetentionService retentionService;
    private final ObjectProvider<MarketDataCollector> collectors;
    private final SchedulerProperties properties;

    @Scheduled(fixedDelayString = "${moneyflow.scheduler.evaluation-interval-seconds:60}000")
    public void runRealtimeCycle() {
        collectors.orderedStream().forEach(this::poll);
        pipelineService.runEvaluationCycle();
    }

    @Scheduled(cron = "${moneyflow.scheduler.retention-cron:0 30 0 * * *}")
    public void runRetention() {
        retentionService.cleanupOldData();
    }

    private void poll(MarketDataCollector collector) {
        List<String> symbols = properties.getSymbols();
        if (symbols.isEmpty()) {
            return;
        }
        try {
            List<Observation> observations = collector.collect(symbols);
            MonitoringPipelineService.IngestResult result = pipelineService.ingest(observations);
            log.info("Collector {} delivered {} observations ({} rejected)",
                    collector.name(), result.accepted(), result.rejected());
        } catch (RuntimeException e) {
            log.error("Collector {} failed: {}", collector.name(), e.getMessage());
        }
    }
}
