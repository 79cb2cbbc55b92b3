package com.moneyflow.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "moneyflow.alerts")
@Data
@Validated
public class AlertProperties {

    @Min(1)
    private int historySize = 500;

    @Positive
    private double escalationConfidence = 0.9;

    private Duration sendTimeout = Duration.ofSeconds(10);

    /**
     * Confidence cut points per severity. Recognized configuration only; alert severity is
     * derived from the signal.
     */
    private Map<String, Double> severityThresholds = defaultThresholds();

    private Routing routing = new Routing();
    private RateLimiting rateLimiting = new RateLimiting();

    @Data
    public static class Routing {
        private List<String> critical = new ArrayList<>(List.of("chat", "email"));
        private List<String> warning = new ArrayList<>(List.of("chat"));
    }

    @Data
    public static class RateLimiting {
        private boolean enabled = true;

        @Min(1)
        private int maxAlertsPerHour = 10;

        @Min(0)
        private int cooldownMinutes = 15;

        private boolean emergencyBypassesCooldown = true;
    }

    private static Map<String, Double> defaultThresholds() {
        Map<String, Double> thresholds = new LinkedHashMap<>();
        thresholds.put("info", 0.0);
        thresholds.put("warning", 0.4);
        thresholds.put("critical", 0.6);
        thresholds.put("emergency", 0.8);
        return thresholds;
    }
}
