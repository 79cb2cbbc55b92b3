package com.moneyflow.backend.service.alert;

import com.moneyflow.backend.model.Signal;

import java.util.Locale;

public final class AlertMessageFormatter {

    private AlertMessageFormatter() {
    }

    /** {@code korea_capital_outflow} becomes {@code Korea Capital Outflow}. */
    public static String scenarioTitle(String scenario) {
        if (scenario == null || scenario.isBlank()) {
            return "";
        }
        StringBuilder title = new StringBuilder();
        for (String word : scenario.split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(Character.toUpperCase(word.charAt(0)))
                    .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return title.toString();
    }

    public static String formatPercent(double fraction) {
        return String.format(Locale.US, "%.1f%%", fraction * 100.0);
    }

    public static String format(Signal signal) {
        StringBuilder message = new StringBuilder();
        message.append('[').append(signal.getSeverity().code().toUpperCase(Locale.ROOT)).append("] ")
                .append(scenarioTitle(signal.getScenario()))
                .append("\n\n");
        message.append("Confidence: ").append(formatPercent(signal.getConfidence())).append("\n\n");
        message.append("Triggers:\n");
        if (signal.getTriggers() != null) {
            for (String trigger : signal.getTriggers()) {
                message.append("• ").append(trigger).append('\n');
            }
        }
        message.append("\nRecommendation:\n").append(signal.getRecommendation() == null ? "" : signal.getRecommendation());
        return message.toString();
    }
}
