package com.moneyflow.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "moneyflow.scheduler")
@Data
public class SchedulerProperties {

    private boolean enabled = false;
    private long evaluationIntervalSeconds = 60;
    private String retentionCron = "0 30 0 * * *";
    private List<String> symbols = new ArrayList<>();
}
