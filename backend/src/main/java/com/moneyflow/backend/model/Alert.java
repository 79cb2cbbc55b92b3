package com.moneyflow.backend.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Immutable alert handed to notification channels.
 */
@Value
@Builder
public class Alert {

    String id;
    String timestamp;
    AlertSeverity severity;
    String scenario;
    double confidence;
    String message;
    List<String> triggers;
    String recommendation;
    Map<String, Object> metadata;
}
