package com.moneyflow.backend.service.alert;

import com.moneyflow.backend.config.AlertProperties;
import com.moneyflow.backend.model.AlertSeverity;
import com.moneyflow.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class AlertRateLimiterTest {

    private MutableClock clock;
    private AlertProperties properties;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-08-05T09:00:00Z"));
        properties = new AlertProperties();
    }

    @Test
    void sameScenarioWaitsForCooldown() {
        AlertRateLimiter limiter = new AlertRateLimiter(properties, clock);

        assertThat(limiter.tryAcquire("risk_off_transition", AlertSeverity.WARNING)).isEqualTo(AlertRateLimiter.Decision.ALLOWED);
        clock.advance(Duration.ofMinutes(14));
        assertThat(limiter.tryAcquire("risk_off_transition", AlertSeverity.CRITICAL)).isEqualTo(AlertRateLimiter.Decision.COOLDOWN);
        assertThat(limiter.tryAcquire("volatility_spike", AlertSeverity.WARNING)).isEqualTo(AlertRateLimiter.Decision.ALLOWED);

        clock.advance(Duration.ofMinutes(1));
        assertThat(limiter.tryAcquire("risk_off_transition", AlertSeverity.WARNING)).isEqualTo(AlertRateLimiter.Decision.ALLOWED);
    }

    @Test
    void hourlyBudgetSpansAllScenarios() {
        AlertRateLimiter limiter = new AlertRateLimiter(properties, clock);
        for (int i = 0; i < 10; i++) {
            assertThat(limiter.tryAcquire("scenario_" + i, AlertSeverity.WARNING)).isEqualTo(AlertRateLimiter.Decision.ALLOWED);
        }

        assertThat(limiter.tryAcquire("scenario_10", AlertSeverity.WARNING)).isEqualTo(AlertRateLimiter.Decision.HOURLY_LIMIT);

        clock.advance(Duration.ofHours(1));
        assertThat(limiter.tryAcquire("scenario_10", AlertSeverity.WARNING)).isEqualTo(AlertRateLimiter.Decision.ALLOWED);
    }

    @Test
    void emergencySkipsCooldownWhenConfigured() {
        AlertRateLimiter limiter = new AlertRateLimiter(properties, clock);
        limiter.tryAcquire("liquidity_crisis", AlertSeverity.CRITICAL);

        assertThat(limiter.tryAcquire("liquidity_crisis", AlertSeverity.EMERGENCY)).isEqualTo(AlertRateLimiter.Decision.ALLOWED);

        properties.getRateLimiting().setEmergencyBypassesCooldown(false);
        AlertRateLimiter strict = new AlertRateLimiter(properties, clock);
        strict.tryAcquire("liquidity_crisis", AlertSeverity.CRITICAL);
        assertThat(strict.tryAcquire("liquidity_crisis", AlertSeverity.EMERGENCY)).isEqualTo(AlertRateLimiter.Decision.COOLDOWN);
    }

    @Test
    void disabledLimiterAllowsEverything() {
        properties.getRateLimiting().setEnabled(false);
        AlertRateLimiter limiter = new AlertRateLimiter(properties, clock);

        for (int i = 0; i < 20; i++) {
            assertThat(limiter.tryAcquire("volatility_spike", AlertSeverity.WARNING)).isEqualTo(AlertRateLimiter.Decision.ALLOWED);
        }
    }

    @Test
    void resetForgetsHistory() {
        AlertRateLimiter limiter = new AlertRateLimiter(properties, clock);
        limiter.tryAcquire("volatility_spike", AlertSeverity.WARNING);

        limiter.reset();

        assertThat(limiter.tryAcquire("volatility_spike", AlertSeverity.WARNING)).isEqualTo(AlertRateLimiter.Decision.ALLOWED);
    }
}
