package com.moneyflow.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "moneyflow.collectors")
@Data
public class CollectorProperties {

    private Http http = new Http();

    @Data
    public static class Http {
        private boolean enabled = false;
        private String quotesUrl;
        private String healthUrl;
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 10000;
    }
}
