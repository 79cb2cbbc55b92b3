package com.moneyflow.backend.service.alert;

import com.moneyflow.backend.config.AlertProperties;
import com.moneyflow.backend.model.AlertSeverity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;

/**
 * Hourly alert budget across all scenarios plus a per-scenario cooldown.
 */
@Component
@Slf4j
public class AlertRateLimiter {

    private static final Duration BUDGET_WINDOW = Duration.ofHours(1);

    public enum Decision {
        ALLOWED,
        HOURLY_LIMIT,
        COOLDOWN
    }

    private final AlertProperties.RateLimiting config;
    private final Clock clock;

    private final ArrayDeque<Instant> issued = new ArrayDeque<>();
    private final Map<String, Instant> lastByScenario = new HashMap<>();

    public AlertRateLimiter(AlertProperties properties, Clock clock) {
        this.config = properties.getRateLimiting();
        this.clock = clock;
    }

    /**
     * Checks the limits and, when allowed, records the alert against them.
     */
    public synchronized Decision tryAcquire(String scenario, AlertSeverity severity) {
        if (!config.isEnabled()) {
            return Decision.ALLOWED;
        }
        Instant now = clock.instant();
        Instant windowStart = now.minus(BUDGET_WINDOW);
        while (!issued.isEmpty() && !issued.peekFirst().isAfter(windowStart)) {
            issued.pollFirst();
        }
        boolean bypassCooldown = severity == AlertSeverity.EMERGENCY && config.isEmergencyBypassesCooldown();
        Instant last = lastByScenario.get(scenario);
        if (!bypassCooldown && last != null
                && now.isBefore(last.plus(Duration.ofMinutes(config.getCooldownMinutes())))) {
            log.debug("Scenario {} in cooldown since {}", scenario, last);
            return Decision.COOLDOWN;
        }
        if (issued.size() >= config.getMaxAlertsPerHour()) {
            log.debug("Hourly alert budget of {} exhausted", config.getMaxAlertsPerHour());
            return Decision.HOURLY_LIMIT;
        }
        issued.addLast(now);
        lastByScenario.put(scenario, now);
        return Decision.ALLOWED;
    }

    public synchronized void reset() {
        issued.clear();
        lastByScenario.clear();
    }
}
