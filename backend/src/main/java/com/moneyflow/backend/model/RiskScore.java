package com.moneyflow.backend.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class RiskScore {

    double total;
    RiskLevel level;
    Map<String, Double> components;
    String recommendation;
    Instant timestamp;
}
