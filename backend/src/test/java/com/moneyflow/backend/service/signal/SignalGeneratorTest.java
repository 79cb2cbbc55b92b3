package com.moneyflow.backend.service.signal;

import com.moneyflow.backend.config.SignalProperties;
import com.moneyflow.backend.model.MarketState;
import com.moneyflow.backend.model.Signal;
import com.moneyflow.backend.model.SignalSeverity;
import com.moneyflow.backend.service.MetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SignalGeneratorTest {

    private static final Instant NOW = Instant.parse("2024-08-05T13:30:00Z");

    private SignalGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new SignalGenerator(new ScenarioRules(new SignalProperties()),
                new MetricsService(new SimpleMeterRegistry()),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void calmMarketProducesNoSignals() {
        assertThat(generator.generateSignals(MarketState.empty())).isEmpty();
        assertThat(generator.generateSignals(null)).isEmpty();
    }

    @Test
    void koreaOutflowNeedsThreeConditions() {
        MarketState two = MarketState.of(Map.of("korea_us_rate_diff", -1.0, "usdkrw_change_1d", 1.5));
        assertThat(generator.generateSignals(two)).isEmpty();

        MarketState three = MarketState.of(Map.of(
                "korea_us_rate_diff", -1.0,
                "usdkrw_change_1d", 1.5,
                "ewy_flow_3d", -250_000));
        Signal warning = single(generator.generateSignals(three));
        assertThat(warning.getScenario()).isEqualTo(ScenarioRules.KOREA_CAPITAL_OUTFLOW);
        assertThat(warning.getSeverity()).isEqualTo(SignalSeverity.WARNING);
        assertThat(warning.getConfidence()).isEqualTo(0.75);
        assertThat(warning.getTimestamp()).isEqualTo(NOW);
        assertThat(warning.getTriggers()).hasSize(3);
        assertThat(warning.getTriggers().get(0)).contains("-1.00");
        assertThat(warning.getTriggers().get(2)).contains("-250,000");
        assertThat(warning.getMetadata()).containsEntry("conditions_met", 3).containsEntry("total_conditions", 4);

        MarketState four = three.merge(Map.of("kospi_foreign_flow", -1_200));
        Signal critical = single(generator.generateSignals(four));
        assertThat(critical.getSeverity()).isEqualTo(SignalSeverity.CRITICAL);
        assertThat(critical.getConfidence()).isEqualTo(1.0);
    }

    @Test
    void riskOffTransition() {
        MarketState state = MarketState.of(Map.of("vix", 35, "tlt_flow", 1_000_000, "hyg_spread", 6.0));

        Signal signal = single(generator.generateSignals(state));

        assertThat(signal.getScenario()).isEqualTo(ScenarioRules.RISK_OFF_TRANSITION);
        assertThat(signal.getSeverity()).isEqualTo(SignalSeverity.CRITICAL);
        assertThat(signal.getConfidence()).isEqualTo(0.75);
        assertThat(signal.getTriggers()).containsExactly(
                "VIX spike: 35.0",
                "Heavy TLT inflow: +1,000,000",
                "High-yield spread widening: 6.00%p");
    }

    @Test
    void goldAndDollarMustMoveTogether() {
        MarketState goldOnly = MarketState.of(Map.of("vix", 35, "tlt_flow", 10, "gold_change", 2.0));
        assertThat(generator.generateSignals(goldOnly)).isEmpty();

        MarketState both = goldOnly.merge(Map.of("dxy_change", 0.8));
        assertThat(single(generator.generateSignals(both)).getScenario()).isEqualTo(ScenarioRules.RISK_OFF_TRANSITION);
    }

    @Test
    void liquidityCrisisIsEmergencyWithCrisisLevel() {
        MarketState moderate = MarketState.of(Map.of("libor_ois_spread", 0.8, "repo_rate_spike", true));
        Signal first = single(generator.generateSignals(moderate));
        assertThat(first.getSeverity()).isEqualTo(SignalSeverity.EMERGENCY);
        assertThat(first.getConfidence()).isEqualTo(0.5);
        assertThat(first.getMetadata()).containsEntry("crisis_level", "moderate");
        assertThat(first.getTriggers()).contains("Repo rate spike detected");

        MarketState severe = moderate.merge(Map.of("corp_bond_issuance_change", -60));
        assertThat(single(generator.generateSignals(severe)).getMetadata()).containsEntry("crisis_level", "severe");
    }

    @Test
    void volatilitySpikeCarriesVixContext() {
        MarketState state = MarketState.of(Map.of("vix", 24.5, "vix_change_1d", 25.0));

        Signal signal = single(generator.generateSignals(state));

        assertThat(signal.getScenario()).isEqualTo(ScenarioRules.VOLATILITY_SPIKE);
        assertThat(signal.getSeverity()).isEqualTo(SignalSeverity.WARNING);
        assertThat(signal.getConfidence()).isEqualTo(0.8);
        assertThat(signal.getTriggers()).containsExactly("VIX spike: +25.0% (current: 24.5)");
        assertThat(signal.getMetadata()).containsEntry("vix", 24.5).containsEntry("vix_change", 25.0);
    }

    @Test
    void severalScenariosFireTogether() {
        MarketState state = MarketState.of(Map.of(
                "vix", 42, "tlt_flow", 5, "hyg_spread", 7.5, "vix_change_1d", 30,
                "libor_ois_spread", 0.9, "move_index", 170));

        List<Signal> signals = generator.generateSignals(state);

        assertThat(signals).extracting(Signal::getScenario).containsExactly(
                ScenarioRules.RISK_OFF_TRANSITION, ScenarioRules.LIQUIDITY_CRISIS, ScenarioRules.VOLATILITY_SPIKE);
    }

    @Test
    void thresholdsComeFromConfiguration() {
        SignalProperties properties = new SignalProperties();
        properties.getVolatilitySpike().setVixChangeThreshold(50);
        SignalGenerator strict = new SignalGenerator(new ScenarioRules(properties),
                new MetricsService(new SimpleMeterRegistry()), Clock.fixed(NOW, ZoneOffset.UTC));

        assertThat(strict.generateSignals(MarketState.of(Map.of("vix_change_1d", 30)))).isEmpty();
    }

    private static Signal single(List<Signal> signals) {
        assertThat(signals).hasSize(1);
        return signals.get(0);
    }
}
