package com.moneyflow.backend.service.notify;

import com.moneyflow.backend.config.NotifierProperties;
import com.moneyflow.backend.exception.NotificationException;
import com.moneyflow.backend.model.Alert;
import com.moneyflow.backend.service.alert.AlertMessageFormatter;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

@Component
@Slf4j
@ConditionalOnProperty(prefix = "moneyflow.notifiers.email", name = "enabled", havingValue = "true")
public class EmailNotifier implements NotificationChannel {

    public static final String NAME = "email";

    private final JavaMailSender mailSender;
    private final NotifierProperties.Email config;

    public EmailNotifier(JavaMailSender mailSender, NotifierProperties properties) {
        this.mailSender = mailSender;
        this.config = properties.getEmail();
        if (config.getFrom() == null || config.getFrom().isBlank()) {
            throw new IllegalStateException("moneyflow.notifiers.email.from is required when email is enabled");
        }
        if (config.getTo() == null || config.getTo().isEmpty()) {
            throw new IllegalStateException("moneyflow.notifiers.email.to needs at least one recipient");
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void send(Alert alert) {
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");
            helper.setFrom(config.getFrom());
            helper.setTo(config.getTo().toArray(new String[0]));
            helper.setSubject(subject(alert));
            helper.setText(alert.getMessage(), html(alert));
            mailSender.send(message);
        } catch (MessagingException | MailException e) {
            throw new NotificationException(NAME, "Email delivery failed: " + e.getMessage(), e);
        }
        log.info("Alert sent via email: {}", alert.getId());
    }

    static String subject(Alert alert) {
        return "[" + alert.getSeverity().name() + "] " + AlertMessageFormatter.scenarioTitle(alert.getScenario());
    }

    static String html(Alert alert) {
        StringBuilder triggers = new StringBuilder();
        for (String trigger : alert.getTriggers()) {
            triggers.append("<div class=\"trigger\">&bull; ").append(HtmlUtils.htmlEscape(trigger)).append("</div>");
        }
        return "<html><head><style>"
                + "body { font-family: Arial, sans-serif; }"
                + ".header { background-color: " + SlackNotifier.color(alert.getSeverity()) + "; color: white; padding: 20px; }"
                + ".content { padding: 20px; }"
                + ".trigger { margin: 10px 0; padding: 10px; background-color: #f5f5f5; }"
                + ".recommendation { margin: 20px 0; padding: 15px; background-color: #e3f2fd; border-left: 4px solid #2196f3; }"
                + ".footer { padding: 10px; text-align: center; color: #666; font-size: 12px; }"
                + "</style></head><body>"
                + "<div class=\"header\"><h2>" + HtmlUtils.htmlEscape(AlertMessageFormatter.scenarioTitle(alert.getScenario())) + "</h2>"
                + "<p>Severity: " + alert.getSeverity().name() + " | Confidence: "
                + AlertMessageFormatter.formatPercent(alert.getConfidence()) + "</p></div>"
                + "<div class=\"content\"><h3>Triggers:</h3>" + triggers
                + "<div class=\"recommendation\"><h3>Recommendation:</h3><p>"
                + HtmlUtils.htmlEscape(alert.getRecommendation() == null ? "" : alert.getRecommendation()) + "</p></div>"
                + "<p><small>Alert ID: " + alert.getId() + "</small></p>"
                + "<p><small>Time: " + alert.getTimestamp() + "</small></p></div>"
                + "<div class=\"footer\"><p>Money Flow Prediction System</p></div>"
                + "</body></html>";
    }
}
