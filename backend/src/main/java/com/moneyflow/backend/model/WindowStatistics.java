package com.moneyflow.backend.model;

public record WindowStatistics(
        String symbol,
        int count,
        double mean,
        double std,
        double min,
        double max,
        double current,
        double changePct
) {
}
