package com.moneyflow.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketDataPointDTO {

    private String symbol;
    private Instant timestamp;
    private double value;
    private Long volume;
    private Double bid;
    private Double ask;
}
