package com.moneyflow.backend.service.alert;

import com.moneyflow.backend.config.AlertProperties;
import com.moneyflow.backend.model.Alert;
import com.moneyflow.backend.model.AlertSeverity;
import com.moneyflow.backend.model.Signal;
import com.moneyflow.backend.service.MetricsService;
import com.moneyflow.backend.service.notify.NotificationChannel;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Turns scenario signals into alerts and fans them out to the registered channels.
 * History and channel registry have their own locks; neither is held while a channel sends.
 */
@Service
@Slf4j
public class AlertEngine {

    private final AlertProperties properties;
    private final AlertRateLimiter rateLimiter;
    private final MetricsService metricsService;
    private final AsyncTaskExecutor dispatchExecutor;
    private final TimeLimiter timeLimiter;
    private final Clock clock;

    private final Map<String, NotificationChannel> channels = new LinkedHashMap<>();
    private final ArrayDeque<Alert> history = new ArrayDeque<>();
    private final List<AlertListener> listeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService timeoutScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "alert-timeout");
        thread.setDaemon(true);
        return thread;
    });

    public AlertEngine(AlertProperties properties,
                       AlertRateLimiter rateLimiter,
                       MetricsService metricsService,
                       @Qualifier("alertDispatchExecutor") AsyncTaskExecutor dispatchExecutor,
                       Clock clock) {
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.metricsService = metricsService;
        this.dispatchExecutor = dispatchExecutor;
        this.clock = clock;
        this.timeLimiter = TimeLimiter.of("alert-dispatch", TimeLimiterConfig.custom()
                .timeoutDuration(properties.getSendTimeout())
                .cancelRunningFuture(false)
                .build());
    }

    public List<Alert> evaluateAlerts(List<Signal> signals) {
        if (signals == null || signals.isEmpty()) {
            return List.of();
        }
        List<Alert> created = new ArrayList<>();
        for (Signal signal : signals) {
            AlertSeverity severity = severityFor(signal);
            if (!severity.isAtLeast(AlertSeverity.WARNING)) {
                log.debug("Signal {} below alert threshold ({})", signal.getScenario(), severity);
                continue;
            }
            AlertRateLimiter.Decision decision = rateLimiter.tryAcquire(signal.getScenario(), severity);
            if (decision != AlertRateLimiter.Decision.ALLOWED) {
                log.info("Alert for {} suppressed: {}", signal.getScenario(), decision);
                metricsService.recordAlertSuppressed(decision.name().toLowerCase());
                continue;
            }
            created.add(createAlert(signal, severity));
        }

        for (Alert alert : created) {
            record(alert);
        }
        // every send is submitted before any outcome is awaited
        List<CompletableFuture<DispatchReport>> reports = new ArrayList<>();
        for (Alert alert : created) {
            reports.add(dispatchAsync(alert));
        }
        CompletableFuture.allOf(reports.toArray(new CompletableFuture[0])).join();
        log.info("Generated {} alerts from {} signals", created.size(), signals.size());
        return created;
    }

    AlertSeverity severityFor(Signal signal) {
        AlertSeverity severity = AlertSeverity.from(signal.getSeverity());
        if (signal.getConfidence() > properties.getEscalationConfidence() && severity != AlertSeverity.EMERGENCY) {
            return severity.escalate();
        }
        return severity;
    }

    private Alert createAlert(Signal signal, AlertSeverity severity) {
        List<String> triggers = signal.getTriggers() == null ? List.of() : List.copyOf(signal.getTriggers());
        Map<String, Object> metadata = signal.getMetadata() == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(signal.getMetadata()));
        return Alert.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC).toString())
                .severity(severity)
                .scenario(signal.getScenario())
                .confidence(signal.getConfidence())
                .message(AlertMessageFormatter.format(signal))
                .triggers(triggers)
                .recommendation(signal.getRecommendation())
                .metadata(metadata)
                .build();
    }

    private void record(Alert alert) {
        synchronized (history) {
            history.addLast(alert);
            while (history.size() > properties.getHistorySize()) {
                history.pollFirst();
            }
        }
        metricsService.recordAlertCreated(alert.getSeverity().name());
        for (AlertListener listener : listeners) {
            try {
                listener.onAlert(alert);
            } catch (RuntimeException e) {
                log.warn("Alert listener {} failed for {}: {}", listener.getClass().getSimpleName(), alert.getId(), e.getMessage());
            }
        }
    }

    /**
     * Sends the alert to every channel its severity routes to and waits for each outcome.
     */
    public DispatchReport dispatch(Alert alert) {
        return dispatchAsync(alert).join();
    }

    /**
     * Starts one send per routed channel. The report completes once every channel has delivered,
     * failed or run past the send timeout; it never completes exceptionally.
     */
    public CompletableFuture<DispatchReport> dispatchAsync(Alert alert) {
        Map<String, NotificationChannel> targets = resolveChannels(alert.getSeverity());
        Map<String, CompletableFuture<DeliveryStatus>> pending = new LinkedHashMap<>();
        targets.forEach((name, channel) -> pending.put(name, send(alert, name, channel)));
        return CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    Map<String, DeliveryStatus> results = new LinkedHashMap<>();
                    pending.forEach((name, outcome) -> results.put(name, outcome.join()));
                    results.forEach((name, status) -> metricsService.recordDelivery(name, status.name().toLowerCase()));
                    return new DispatchReport(alert.getId(), Collections.unmodifiableMap(results));
                });
    }

    private CompletableFuture<DeliveryStatus> send(Alert alert, String name, NotificationChannel channel) {
        CompletableFuture<Boolean> sent;
        try {
            sent = CompletableFuture.supplyAsync(() -> {
                channel.send(alert);
                return Boolean.TRUE;
            }, dispatchExecutor);
        } catch (RuntimeException e) {
            log.error("Could not schedule alert {} for {}: {}", alert.getId(), name, e.getMessage());
            return CompletableFuture.completedFuture(DeliveryStatus.FAILED);
        }
        return timeLimiter.executeCompletionStage(timeoutScheduler, () -> sent)
                .toCompletableFuture()
                .handle((ok, error) -> outcome(alert, name, error));
    }

    private DeliveryStatus outcome(Alert alert, String name, Throwable error) {
        if (error == null) {
            log.info("Alert {} sent to {}", alert.getId(), name);
            return DeliveryStatus.DELIVERED;
        }
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            log.error("Alert {} timed out on {} after {}", alert.getId(), name, properties.getSendTimeout());
            return DeliveryStatus.TIMED_OUT;
        }
        log.error("Failed to send alert {} to {}: {}", alert.getId(), name, cause.getMessage());
        return DeliveryStatus.FAILED;
    }

    private Map<String, NotificationChannel> resolveChannels(AlertSeverity severity) {
        synchronized (channels) {
            Map<String, NotificationChannel> targets = new LinkedHashMap<>();
            switch (severity) {
                case EMERGENCY -> targets.putAll(channels);
                case CRITICAL -> addRouted(targets, properties.getRouting().getCritical());
                case WARNING -> addRouted(targets, properties.getRouting().getWarning());
                default -> {
                    // INFO is never dispatched
                }
            }
            return targets;
        }
    }

    private void addRouted(Map<String, NotificationChannel> targets, List<String> names) {
        for (String name : names) {
            NotificationChannel channel = channels.get(name);
            if (channel != null) {
                targets.put(name, channel);
            }
        }
    }

    public void registerNotifier(String name, NotificationChannel channel) {
        synchronized (channels) {
            channels.put(name, channel);
        }
        log.info("Registered notifier: {}", name);
    }

    public void unregisterNotifier(String name) {
        synchronized (channels) {
            channels.remove(name);
        }
        log.info("Unregistered notifier: {}", name);
    }

    public List<String> getRegisteredChannels() {
        synchronized (channels) {
            return List.copyOf(channels.keySet());
        }
    }

    public void addListener(AlertListener listener) {
        listeners.add(listener);
    }

    public List<Alert> getRecentAlerts(int limit) {
        synchronized (history) {
            if (limit <= 0) {
                return List.of();
            }
            List<Alert> all = new ArrayList<>(history);
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        }
    }

    public void clearHistory() {
        synchronized (history) {
            history.clear();
        }
        log.info("Alert history cleared");
    }
}
