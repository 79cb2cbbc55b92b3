package com.moneyflow.backend.service.signal;

import com.moneyflow.backend.config.SignalProperties;
import com.moneyflow.backend.model.MarketState;
import com.moneyflow.backend.model.SignalSeverity;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rule table for the monitored scenarios, thresholds taken from {@link SignalProperties}.
 */
@Component
public class ScenarioRules {

    public static final String KOREA_CAPITAL_OUTFLOW = "korea_capital_outflow";
    public static final String RISK_OFF_TRANSITION = "risk_off_transition";
    public static final String LIQUIDITY_CRISIS = "liquidity_crisis";
    public static final String VOLATILITY_SPIKE = "volatility_spike";

    private static final int FOUR_CONDITIONS = 4;

    private final List<ScenarioRule> rules;

    public ScenarioRules(SignalProperties properties) {
        this.rules = List.of(
                koreaCapitalOutflow(properties.getKoreaOutflow()),
                riskOffTransition(properties.getRiskOff()),
                liquidityCrisis(properties.getLiquidityCrisis()),
                volatilitySpike(properties.getVolatilitySpike()));
    }

    public List<ScenarioRule> all() {
        return rules;
    }

    private static ScenarioRule koreaCapitalOutflow(SignalProperties.KoreaOutflow config) {
        return ScenarioRule.builder()
                .scenario(KOREA_CAPITAL_OUTFLOW)
                .condition(new ScenarioCondition("korea_us_rate_diff",
                        s -> s.getDouble("korea_us_rate_diff", 0) < config.getRateDiffThreshold(),
                        s -> format("Korea-US rate differential inverted: %.2f%%p", s.getDouble("korea_us_rate_diff", 0))))
                .condition(new ScenarioCondition("usdkrw_change_1d",
                        s -> s.getDouble("usdkrw_change_1d", 0) > config.getUsdkrwChangeThreshold(),
                        s -> format("USD/KRW surge: +%.2f%%", s.getDouble("usdkrw_change_1d", 0))))
                .condition(new ScenarioCondition("ewy_flow_3d",
                        s -> s.getDouble("ewy_flow_3d", 0) < 0,
                        s -> format("EWY ETF net outflow: %,.0f", s.getDouble("ewy_flow_3d", 0))))
                .condition(new ScenarioCondition("kospi_foreign_flow",
                        s -> s.getDouble("kospi_foreign_flow", 0) < 0,
                        s -> format("KOSPI foreign net selling: %,.0f (100M KRW)", s.getDouble("kospi_foreign_flow", 0))))
                .minConditions(config.getMinConditions())
                .severity(met -> met == FOUR_CONDITIONS ? SignalSeverity.CRITICAL : SignalSeverity.WARNING)
                .confidence(met -> met / (double) FOUR_CONDITIONS)
                .recommendation("Reduce positions or review hedges. Prepare for KRW weakness.")
                .metadata((met, state) -> conditionMetadata(met))
                .build();
    }

    private static ScenarioRule riskOffTransition(SignalProperties.RiskOff config) {
        return ScenarioRule.builder()
                .scenario(RISK_OFF_TRANSITION)
                .condition(new ScenarioCondition("vix",
                        s -> s.getDouble("vix", 0) > config.getVixThreshold(),
                        s -> format("VIX spike: %.1f", s.getDouble("vix", 0))))
                .condition(new ScenarioCondition("tlt_flow",
                        s -> s.getDouble("tlt_flow", 0) > 0,
                        s -> format("Heavy TLT inflow: +%,.0f", s.getDouble("tlt_flow", 0))))
                .condition(new ScenarioCondition("hyg_spread",
                        s -> s.getDouble("hyg_spread", 0) > config.getHygSpreadThreshold(),
                        s -> format("High-yield spread widening: %.2f%%p", s.getDouble("hyg_spread", 0))))
                .condition(new ScenarioCondition("gold_dxy",
                        s -> s.getDouble("gold_change", 0) > config.getGoldChangeThreshold()
                                && s.getDouble("dxy_change", 0) > config.getDxyChangeThreshold(),
                        s -> format("Gold rally with dollar strength: gold %+.2f%%, DXY %+.2f%%",
                                s.getDouble("gold_change", 0), s.getDouble("dxy_change", 0))))
                .minConditions(config.getMinConditions())
                .severity(met -> SignalSeverity.CRITICAL)
                .confidence(met -> met / (double) FOUR_CONDITIONS)
                .recommendation("Cut equity exposure, hold cash and short-term bonds until volatility subsides.")
                .metadata((met, state) -> conditionMetadata(met))
                .build();
    }

    private static ScenarioRule liquidityCrisis(SignalProperties.LiquidityCrisis config) {
        return ScenarioRule.builder()
                .scenario(LIQUIDITY_CRISIS)
                .condition(new ScenarioCondition("libor_ois_spread",
                        s -> s.getDouble("libor_ois_spread", 0) > config.getLiborOisThreshold(),
                        s -> format("LIBOR-OIS spread surge: %.2f%%p", s.getDouble("libor_ois_spread", 0))))
                .condition(new ScenarioCondition("repo_rate_spike",
                        s -> s.getBoolean("repo_rate_spike", false),
                        s -> "Repo rate spike detected"))
                .condition(new ScenarioCondition("move_index",
                        s -> s.getDouble("move_index", 0) > config.getMoveThreshold(),
                        s -> format("MOVE index surge: %.1f", s.getDouble("move_index", 0))))
                .condition(new ScenarioCondition("corp_bond_issuance_change",
                        s -> s.getDouble("corp_bond_issuance_change", 0) < config.getBondIssuanceDropThreshold(),
                        s -> format("Corporate bond issuance collapse: %.1f%%", s.getDouble("corp_bond_issuance_change", 0))))
                .minConditions(config.getMinConditions())
                .severity(met -> SignalSeverity.EMERGENCY)
                .confidence(met -> met / (double) FOUR_CONDITIONS)
                .recommendation("Move to an extremely defensive posture and prioritize cash. Pattern resembles the 2008 credit crisis.")
                .metadata((met, state) -> {
                    Map<String, Object> metadata = conditionMetadata(met);
                    metadata.put("crisis_level", met >= config.getSevereConditions() ? "severe" : "moderate");
                    return metadata;
                })
                .build();
    }

    private static ScenarioRule volatilitySpike(SignalProperties.VolatilitySpike config) {
        return ScenarioRule.builder()
                .scenario(VOLATILITY_SPIKE)
                .condition(new ScenarioCondition("vix_change_1d",
                        s -> s.getDouble("vix_change_1d", 0) > config.getVixChangeThreshold(),
                        s -> format("VIX spike: +%.1f%% (current: %.1f)",
                                s.getDouble("vix_change_1d", 0), s.getDouble("vix", 0))))
                .minConditions(1)
                .severity(met -> SignalSeverity.WARNING)
                .confidence(met -> config.getConfidence())
                .recommendation("Short-term volatility rising. Consider smaller position sizes.")
                .metadata((met, state) -> {
                    Map<String, Object> metadata = new LinkedHashMap<>();
                    metadata.put("conditions_met", met);
                    metadata.put("vix", state.getDouble("vix", 0));
                    metadata.put("vix_change", state.getDouble("vix_change_1d", 0));
                    return metadata;
                })
                .build();
    }

    private static Map<String, Object> conditionMetadata(int met) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("conditions_met", met);
        metadata.put("total_conditions", FOUR_CONDITIONS);
        return metadata;
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.US, pattern, args);
    }
}
