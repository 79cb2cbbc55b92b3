package com.moneyflow.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final AtomicLong ticksProcessed = new AtomicLong();
    private final AtomicLong alertsCreated = new AtomicLong();
    private final AtomicLong alertsSuppressed = new AtomicLong();

    public void recordTick(String symbol) {
        ticksProcessed.incrementAndGet();
        Counter.builder("stream_ticks_total").register(meterRegistry).increment();
    }

    public void recordStreamSignal(String signalType) {
        Counter.builder("stream_signals_total")
                .tag("type", signalType)
                .register(meterRegistry)
                .increment();
    }

    public void recordRejectedObservations(int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder("observations_rejected_total").register(meterRegistry).increment(count);
    }

    public void recordAnomalies(String method, int count) {
        Counter.builder("anomalies_detected_total")
                .tag("method", method)
                .register(meterRegistry)
                .increment(count);
    }

    public void recordSignal(String scenario) {
        Counter.builder("scenario_signals_total")
                .tag("scenario", scenario)
                .register(meterRegistry)
                .increment();
    }

    public void recordAlertCreated(String severity) {
        alertsCreated.incrementAndGet();
        Counter.builder("alerts_created_total")
                .tag("severity", severity)
                .register(meterRegistry)
                .increment();
    }

    public void recordAlertSuppressed(String reason) {
        alertsSuppressed.incrementAndGet();
        Counter.builder("alerts_suppressed_total")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordDelivery(String channel, String status) {
        Counter.builder("alert_deliveries_total")
                .tag("channel", channel)
                .tag("status", status)
                .register(meterRegistry)
                .increment();
    }

    public long getTicksProcessed() {
        return ticksProcessed.get();
    }

    public long getAlertsCreated() {
        return alertsCreated.get();
    }

    public long getAlertsSuppressed() {
        return alertsSuppressed.get();
    }
}
