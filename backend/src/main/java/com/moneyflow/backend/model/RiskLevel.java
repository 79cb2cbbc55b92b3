package com.moneyflow.backend.model;

public enum RiskLevel {
    MINIMAL("Minimal risk. Aggressive positioning is acceptable; lean into growth opportunities."),
    LOW("Low risk. Normal position management; stay ready to act on opportunities."),
    MODERATE("Moderate risk. Proceed carefully, keep the portfolio diversified and monitor closely."),
    HIGH("High risk. Reduce positions, prepare for volatility and respect stop-loss levels strictly."),
    EXTREME("Extreme risk. Defensive positioning required: maximize cash and execute hedges immediately.");

    private final String recommendation;

    RiskLevel(String recommendation) {
        this.recommendation = recommendation;
    }

    public String recommendation() {
        return recommendation;
    }

    public static RiskLevel fromScore(double score) {
        if (score > 80) {
            return EXTREME;
        }
        if (score > 60) {
            return HIGH;
        }
        if (score > 40) {
            return MODERATE;
        }
        if (score > 20) {
            return LOW;
        }
        return MINIMAL;
    }
}
