package com.moneyflow.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "moneyflow.notifiers")
@Data
public class NotifierProperties {

    private Slack slack = new Slack();
    private Email email = new Email();
    private Dashboard dashboard = new Dashboard();

    @Data
    public static class Slack {
        private boolean enabled = false;
        private String webhookUrl;
        private String channel;
        private String username = "Money Flow Bot";
        private int connectTimeoutMs = 10000;
        private int readTimeoutMs = 10000;
    }

    @Data
    public static class Email {
        private boolean enabled = false;
        private String from;
        private List<String> to = new ArrayList<>();
    }

    @Data
    public static class Dashboard {
        private boolean enabled = true;
        private String topic = "/topic/alerts";
    }
}
