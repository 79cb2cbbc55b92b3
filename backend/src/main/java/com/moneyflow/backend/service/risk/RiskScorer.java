package com.moneyflow.backend.service.risk;

import com.moneyflow.backend.config.RiskScoringProperties;
import com.moneyflow.backend.model.MarketState;
import com.moneyflow.backend.model.RiskLevel;
import com.moneyflow.backend.model.RiskScore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weighted composite of the component rules.
 */
@Service
@Slf4j
public class RiskScorer {

    private static final double WEIGHT_TOLERANCE = 1e-6;

    private final RiskComponentRules componentRules;
    private final Map<String, Double> weights;
    private final Clock clock;

    public RiskScorer(RiskComponentRules componentRules, RiskScoringProperties properties, Clock clock) {
        this.componentRules = componentRules;
        this.weights = Collections.unmodifiableMap(properties.getWeights().asMap());
        this.clock = clock;
        double sum = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalStateException("Risk weights must sum to 1.0 but sum to " + sum);
        }
    }

    public RiskScore calculateRiskScore(MarketState state) {
        MarketState snapshot = state == null ? MarketState.empty() : state;
        Map<String, Double> components = new LinkedHashMap<>();
        double total = 0.0;
        for (RiskComponentRule rule : componentRules.all()) {
            double score = rule.score(snapshot);
            components.put(rule.name(), score);
            total += score * weights.getOrDefault(rule.name(), 0.0);
        }
        total = Math.round(total * 100.0) / 100.0;
        RiskLevel level = RiskLevel.fromScore(total);
        log.info("Risk score {} ({})", total, level);
        return RiskScore.builder()
                .total(total)
                .level(level)
                .components(Collections.unmodifiableMap(components))
                .recommendation(level.recommendation())
                .timestamp(clock.instant())
                .build();
    }

    public Map<String, Double> getWeights() {
        return weights;
    }
}
