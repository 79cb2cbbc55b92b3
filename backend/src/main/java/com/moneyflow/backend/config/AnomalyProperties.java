package com.moneyflow.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "moneyflow.anomaly")
@Data
@Validated
public class AnomalyProperties {

    @Positive
    private double zScoreThreshold = 2.0;

    @Min(2)
    private int minStatisticalSamples = 30;

    @Min(1)
    private int maxResults = 50;

    private Ml ml = new Ml();
    private Pattern pattern = new Pattern();

    @Data
    public static class Ml {
        @Min(2)
        private int minRows = 100;

        @DecimalMin("0.0")
        @DecimalMax("0.5")
        private double contamination = 0.1;

        private long randomSeed = 42L;

        @Min(1)
        private int numberOfTrees = 50;

        @Min(2)
        private int maxSampleSize = 256;
    }

    @Data
    public static class Pattern {
        private String volumeColumn = "volume";

        @Min(2)
        private int rollingWindow = 20;

        @Positive
        private double spikeRatio = 3.0;
    }
}
