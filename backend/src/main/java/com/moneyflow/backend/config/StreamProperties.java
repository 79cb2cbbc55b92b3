package com.moneyflow.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "moneyflow.stream")
@Data
@Validated
public class StreamProperties {

    @Min(2)
    private int windowSize = 100;

    @Min(2)
    private int minSamples = 30;

    @Positive
    private double zScoreThreshold = 2.0;
}
