package com.moneyflow.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity vocabulary of scenario signals. Kept apart from {@link AlertSeverity};
 * the only conversion is {@link AlertSeverity#from(SignalSeverity)}.
 */
public enum SignalSeverity {
    INFO("info"),
    WARNING("warning"),
    CRITICAL("critical"),
    EMERGENCY("emergency");

    private final String code;

    SignalSeverity(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static SignalSeverity fromCode(String code) {
        if (code == null) {
            return INFO;
        }
        for (SignalSeverity severity : values()) {
            if (severity.code.equalsIgnoreCase(code.trim())) {
                return severity;
            }
        }
        return INFO;
    }
}
