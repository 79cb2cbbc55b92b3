package com.moneyflow.backend.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class Signal {

    String scenario;
    SignalSeverity severity;
    double confidence;
    List<String> triggers;
    String recommendation;
    Instant timestamp;
    Map<String, Object> metadata;
}
