package com.moneyflow.backend.service.notify;

import com.moneyflow.backend.config.NotifierProperties;
import com.moneyflow.backend.exception.NotificationException;
import com.moneyflow.backend.model.Alert;
import com.moneyflow.backend.model.AlertSeverity;
import com.moneyflow.backend.service.alert.AlertMessageFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts alerts to a Slack incoming webhook as a single colored attachment.
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "moneyflow.notifiers.slack", name = "enabled", havingValue = "true")
public class SlackNotifier implements NotificationChannel {

    public static final String NAME = "chat";

    private final RestTemplate restTemplate;
    private final NotifierProperties.Slack config;

    public SlackNotifier(@Qualifier("notifierRestTemplate") RestTemplate restTemplate, NotifierProperties properties) {
        this.restTemplate = restTemplate;
        this.config = properties.getSlack();
        if (config.getWebhookUrl() == null || config.getWebhookUrl().isBlank()) {
            throw new IllegalStateException("moneyflow.notifiers.slack.webhook-url is required when Slack is enabled");
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void send(Alert alert) {
        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(config.getWebhookUrl(), buildPayload(alert), String.class);
        } catch (RestClientException e) {
            throw new NotificationException(NAME, "Slack webhook call failed: " + e.getMessage(), e);
        }
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new NotificationException(NAME, "Slack API error: " + response.getStatusCode().value());
        }
        log.info("Alert sent to Slack: {}", alert.getId());
    }

    Map<String, Object> buildPayload(Alert alert) {
        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", color(alert.getSeverity()));
        attachment.put("title", AlertMessageFormatter.scenarioTitle(alert.getScenario()));
        attachment.put("text", alert.getMessage());
        attachment.put("fields", List.of(
                field("Severity", alert.getSeverity().name()),
                field("Confidence", AlertMessageFormatter.formatPercent(alert.getConfidence()))));
        attachment.put("footer", "Money Flow Prediction System");
        Long ts = epochSeconds(alert.getTimestamp());
        if (ts != null) {
            attachment.put("ts", ts);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("username", config.getUsername());
        payload.put("attachments", List.of(attachment));
        if (config.getChannel() != null && !config.getChannel().isBlank()) {
            payload.put("channel", config.getChannel());
        }
        return payload;
    }

    static String color(AlertSeverity severity) {
        return switch (severity) {
            case INFO -> "#36a64f";
            case WARNING -> "#ff9900";
            case CRITICAL -> "#ff0000";
            case EMERGENCY -> "#8b0000";
        };
    }

    private static Map<String, Object> field(String title, String value) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("title", title);
        field.put("value", value);
        field.put("short", true);
        return field;
    }

    private static Long epochSeconds(String timestamp) {
        if (timestamp == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(timestamp).toEpochSecond();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable alert timestamp {}", timestamp);
            return null;
        }
    }
}
