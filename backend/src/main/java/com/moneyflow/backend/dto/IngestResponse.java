package com.moneyflow.backend.dto;

import com.moneyflow.backend.model.ProcessedSignal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestResponse {

    private int accepted;
    private int rejected;
    private List<ProcessedSignal> processedSignals;
}
