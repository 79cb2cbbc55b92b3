package com.moneyflow.backend.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "moneyflow.storage")
@Data
@Validated
public class StorageProperties {

    @Min(1)
    private int retentionDays = 30;

    @Min(1)
    private int defaultQueryLimit = 1000;

    @Min(1)
    private int defaultLookbackHours = 24;
}
