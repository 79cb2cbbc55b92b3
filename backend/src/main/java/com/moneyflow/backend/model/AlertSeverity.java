package com.moneyflow.backend.model;

public enum AlertSeverity {
    INFO(1),
    WARNING(2),
    CRITICAL(3),
    EMERGENCY(4);

    private final int level;

    AlertSeverity(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    public boolean isAtLeast(AlertSeverity other) {
        return level >= other.level;
    }

    public AlertSeverity escalate() {
        return this == EMERGENCY ? EMERGENCY : values()[ordinal() + 1];
    }

    public static AlertSeverity from(SignalSeverity severity) {
        if (severity == null) {
            return INFO;
        }
        return switch (severity) {
            case INFO -> INFO;
            case WARNING -> WARNING;
            case CRITICAL -> CRITICAL;
            case EMERGENCY -> EMERGENCY;
        };
    }
}
