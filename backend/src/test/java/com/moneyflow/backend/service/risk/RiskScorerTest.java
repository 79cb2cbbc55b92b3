package com.moneyflow.backend.service.risk;

import com.moneyflow.backend.config.RiskScoringProperties;
import com.moneyflow.backend.model.MarketState;
import com.moneyflow.backend.model.RiskLevel;
import com.moneyflow.backend.model.RiskScore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static com.moneyflow.backend.config.RiskScoringProperties.CREDIT_RISK;
import static com.moneyflow.backend.config.RiskScoringProperties.CURRENCY_RISK;
import static com.moneyflow.backend.config.RiskScoringProperties.GEOPOLITICAL_RISK;
import static com.moneyflow.backend.config.RiskScoringProperties.LIQUIDITY_RISK;
import static com.moneyflow.backend.config.RiskScoringProperties.MARKET_VOLATILITY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RiskScorerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-01-02T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void defaultStateIsMinimal() {
        RiskScore score = scorer(new RiskScoringProperties()).calculateRiskScore(MarketState.empty());

        assertThat(score.getTotal()).isEqualTo(17.5);
        assertThat(score.getLevel()).isEqualTo(RiskLevel.MINIMAL);
        assertThat(score.getRecommendation()).isEqualTo(RiskLevel.MINIMAL.recommendation());
        assertThat(score.getComponents())
                .containsEntry(MARKET_VOLATILITY, 10.0)
                .containsEntry(LIQUIDITY_RISK, 20.0)
                .containsEntry(CREDIT_RISK, 15.0)
                .containsEntry(CURRENCY_RISK, 20.0)
                .containsEntry(GEOPOLITICAL_RISK, 30.0);
        assertThat(score.getTimestamp()).isEqualTo(clock.instant());
    }

    @Test
    void stressedStateIsExtremeAndComponentsClamped() {
        Map<String, Object> values = new HashMap<>();
        values.put("vix", 45);
        values.put("vix_change_5d", 25);
        values.put("spread_widening", true);
        values.put("volume_ratio", 0.5);
        values.put("move_index", 160);
        values.put("hyg_spread", 8);
        values.put("ig_spread", 2.5);
        values.put("default_rate_change", 1.0);
        values.put("dxy_change_1m", 6);
        values.put("em_fx_stress", true);
        values.put("usdjpy_change_1w", -4);
        values.put("oil_volatility", 6);
        values.put("gold_change_1m", 12);

        RiskScore score = scorer(new RiskScoringProperties()).calculateRiskScore(MarketState.of(values));

        assertThat(score.getComponents())
                .containsEntry(MARKET_VOLATILITY, 100.0)
                .containsEntry(LIQUIDITY_RISK, 95.0)
                .containsEntry(CREDIT_RISK, 100.0)
                .containsEntry(CURRENCY_RISK, 95.0)
                .containsEntry(GEOPOLITICAL_RISK, 75.0);
        assertThat(score.getTotal()).isEqualTo(95.25);
        assertThat(score.getLevel()).isEqualTo(RiskLevel.EXTREME);
    }

    @Test
    void volatilityBands() {
        assertThat(RiskComponentRules.volatility(MarketState.of(Map.of("vix", 17)))).isEqualTo(25);
        assertThat(RiskComponentRules.volatility(MarketState.of(Map.of("vix", 25)))).isEqualTo(50);
        assertThat(RiskComponentRules.volatility(MarketState.of(Map.of("vix", 35)))).isEqualTo(75);
    }

    @Test
    void liquidityHighVolumeAndElevatedMove() {
        MarketState state = MarketState.of(Map.of("volume_ratio", 1.8, "move_index", 130));

        assertThat(RiskComponentRules.liquidity(state)).isEqualTo(50);
    }

    @Test
    void levelBoundariesAreExclusive() {
        assertThat(RiskLevel.fromScore(20)).isEqualTo(RiskLevel.MINIMAL);
        assertThat(RiskLevel.fromScore(20.01)).isEqualTo(RiskLevel.LOW);
        assertThat(RiskLevel.fromScore(60)).isEqualTo(RiskLevel.MODERATE);
        assertThat(RiskLevel.fromScore(80.5)).isEqualTo(RiskLevel.EXTREME);
    }

    @Test
    void rejectsWeightsNotSummingToOne() {
        RiskScoringProperties properties = new RiskScoringProperties();
        properties.getWeights().setGeopoliticalRisk(0.3);

        assertThatThrownBy(() -> scorer(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("sum to 1.0");
    }

    private RiskScorer scorer(RiskScoringProperties properties) {
        return new RiskScorer(new RiskComponentRules(), properties, clock);
    }
}
