package com.moneyflow.backend.config;

import jakarta.validation.constraints.DecimalMin;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "moneyflow.risk")
@Data
@Validated
public class RiskScoringProperties {

    public static final String MARKET_VOLATILITY = "market_volatility";
    public static final String LIQUIDITY_RISK = "liquidity_risk";
    public static final String CREDIT_RISK = "credit_risk";
    public static final String CURRENCY_RISK = "currency_risk";
    public static final String GEOPOLITICAL_RISK = "geopolitical_risk";

    private Weights weights = new Weights();

    @Data
    public static class Weights {
        @DecimalMin("0.0")
        private double marketVolatility = 0.25;

        @DecimalMin("0.0")
        private double liquidityRisk = 0.25;

        @DecimalMin("0.0")
        private double creditRisk = 0.20;

        @DecimalMin("0.0")
        private double currencyRisk = 0.20;

        @DecimalMin("0.0")
        private double geopoliticalRisk = 0.10;

        public Map<String, Double> asMap() {
            Map<String, Double> map = new LinkedHashMap<>();
            map.put(MARKET_VOLATILITY, marketVolatility);
            map.put(LIQUIDITY_RISK, liquidityRisk);
            map.put(CREDIT_RISK, creditRisk);
            map.put(CURRENCY_RISK, currencyRisk);
            map.put(GEOPOLITICAL_RISK, geopoliticalRisk);
            return map;
        }
    }
}
