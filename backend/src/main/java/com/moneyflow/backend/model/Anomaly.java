package com.moneyflow.backend.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class Anomaly {

    String symbol;
    String timestamp;
    AnomalyMethod method;
    AnomalySeverity severity;
    double score;
    Map<String, Object> details;
}
