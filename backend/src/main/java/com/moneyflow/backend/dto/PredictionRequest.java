package com.moneyflow.backend.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictionRequest {

    @NotBlank
    @Size(max = 32)
    private String modelType;

    @Size(max = 16)
    private String direction;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double confidence;

    private Map<String, Object> payload;
}
