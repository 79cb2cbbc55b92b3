package com.moneyflow.backend.service.risk;

import com.moneyflow.backend.model.MarketState;

import java.util.function.ToDoubleFunction;

/**
 * Scores one risk component of a market snapshot on a 0-100 scale.
 */
public record RiskComponentRule(String name, ToDoubleFunction<MarketState> scorer) {

    public double score(MarketState state) {
        double raw = scorer.applyAsDouble(state);
        return Math.max(0.0, Math.min(100.0, raw));
    }
}
