package com.moneyflow.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignalRecordDTO {

    private Long id;
    private String scenario;
    private String severity;
    private double confidence;
    private List<String> triggers;
    private String recommendation;
    private Map<String, Object> metadata;
    private boolean active;
    private Instant timestamp;
}
