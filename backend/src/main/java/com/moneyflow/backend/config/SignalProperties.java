package com.moneyflow.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Scenario thresholds. Defaults are the reference rule table values.
 */
@Configuration
@ConfigurationProperties(prefix = "moneyflow.signals")
@Data
@Validated
public class SignalProperties {

    private KoreaOutflow koreaOutflow = new KoreaOutflow();
    private RiskOff riskOff = new RiskOff();
    private LiquidityCrisis liquidityCrisis = new LiquidityCrisis();
    private VolatilitySpike volatilitySpike = new VolatilitySpike();

    @Data
    public static class KoreaOutflow {
        private double rateDiffThreshold = -0.5;
        private double usdkrwChangeThreshold = 1.0;
        private int minConditions = 3;
    }

    @Data
    public static class RiskOff {
        private double vixThreshold = 30.0;
        private double hygSpreadThreshold = 5.0;
        private double goldChangeThreshold = 1.0;
        private double dxyChangeThreshold = 0.5;
        private int minConditions = 3;
    }

    @Data
    public static class LiquidityCrisis {
        private double liborOisThreshold = 0.5;
        private double moveThreshold = 150.0;
        private double bondIssuanceDropThreshold = -50.0;
        private int minConditions = 2;
        private int severeConditions = 3;
    }

    @Data
    public static class VolatilitySpike {
        private double vixChangeThreshold = 20.0;
        private double confidence = 0.8;
    }
}
