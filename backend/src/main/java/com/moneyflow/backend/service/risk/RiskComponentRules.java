package com.moneyflow.backend.service.risk;

import com.moneyflow.backend.model.MarketState;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.moneyflow.backend.config.RiskScoringProperties.CREDIT_RISK;
import static com.moneyflow.backend.config.RiskScoringProperties.CURRENCY_RISK;
import static com.moneyflow.backend.config.RiskScoringProperties.GEOPOLITICAL_RISK;
import static com.moneyflow.backend.config.RiskScoringProperties.LIQUIDITY_RISK;
import static com.moneyflow.backend.config.RiskScoringProperties.MARKET_VOLATILITY;

@Component
public class RiskComponentRules {

    private final List<RiskComponentRule> rules = List.of(
            new RiskComponentRule(MARKET_VOLATILITY, RiskComponentRules::volatility),
            new RiskComponentRule(LIQUIDITY_RISK, RiskComponentRules::liquidity),
            new RiskComponentRule(CREDIT_RISK, RiskComponentRules::credit),
            new RiskComponentRule(CURRENCY_RISK, RiskComponentRules::currency),
            new RiskComponentRule(GEOPOLITICAL_RISK, RiskComponentRules::geopolitical));

    public List<RiskComponentRule> all() {
        return rules;
    }

    static double volatility(MarketState state) {
        double vix = state.getDouble("vix", 15.0);
        double score;
        if (vix < 15) {
            score = 10;
        } else if (vix < 20) {
            score = 25;
        } else if (vix < 30) {
            score = 50;
        } else if (vix < 40) {
            score = 75;
        } else {
            score = 95;
        }
        if (state.getDouble("vix_change_5d", 0) > 20) {
            score += 15;
        }
        return score;
    }

    static double liquidity(MarketState state) {
        double score = 20;
        if (state.getBoolean("spread_widening", false)) {
            score += 25;
        }
        double volumeRatio = state.getDouble("volume_ratio", 1.0);
        if (volumeRatio < 0.7) {
            score += 20;
        } else if (volumeRatio > 1.5) {
            score += 15;
        }
        double move = state.getDouble("move_index", 80);
        if (move > 150) {
            score += 30;
        } else if (move > 120) {
            score += 15;
        }
        return score;
    }

    static double credit(MarketState state) {
        double score = 15;
        double hyg = state.getDouble("hyg_spread", 3.0);
        if (hyg > 7) {
            score += 40;
        } else if (hyg > 5) {
            score += 25;
        } else if (hyg > 4) {
            score += 10;
        }
        double ig = state.getDouble("ig_spread", 1.0);
        if (ig > 2) {
            score += 20;
        } else if (ig > 1.5) {
            score += 10;
        }
        if (state.getDouble("default_rate_change", 0) > 0.5) {
            score += 25;
        }
        return score;
    }

    static double currency(MarketState state) {
        double score = 20;
        double dxyChange = state.getDouble("dxy_change_1m", 0);
        if (dxyChange > 5) {
            score += 30;
        } else if (dxyChange > 3) {
            score += 15;
        }
        if (state.getBoolean("em_fx_stress", false)) {
            score += 25;
        }
        if (Math.abs(state.getDouble("usdjpy_change_1w", 0)) > 3) {
            score += 20;
        }
        return score;
    }

    static double geopolitical(MarketState state) {
        double score = 30;
        if (state.getDouble("oil_volatility", 0) > 5) {
            score += 25;
        }
        if (state.getDouble("gold_change_1m", 0) > 10) {
            score += 20;
        }
        return score;
    }
}
