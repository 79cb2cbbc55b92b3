package com.moneyflow.backend.service.notify;

import com.moneyflow.backend.config.NotifierProperties;
import com.moneyflow.backend.exception.NotificationException;
import com.moneyflow.backend.model.Alert;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes alerts to dashboard clients subscribed over STOMP.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "moneyflow.notifiers.dashboard", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DashboardNotifier implements NotificationChannel {

    public static final String NAME = "dashboard";

    private final SimpMessagingTemplate messagingTemplate;
    private final NotifierProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void send(Alert alert) {
        try {
            messagingTemplate.convertAndSend(properties.getDashboard().getTopic(), alert);
        } catch (MessagingException e) {
            throw new NotificationException(NAME, "Dashboard broadcast failed: " + e.getMessage(), e);
        }
    }
}
