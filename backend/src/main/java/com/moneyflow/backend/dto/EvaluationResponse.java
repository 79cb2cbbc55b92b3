package com.moneyflow.backend.dto;

import com.moneyflow.backend.model.Alert;
import com.moneyflow.backend.model.RiskScore;
import com.moneyflow.backend.model.Signal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationResponse {

    private Instant evaluatedAt;
    private List<Signal> signals;
    private List<Alert> alerts;
    private RiskScore riskScore;
}
