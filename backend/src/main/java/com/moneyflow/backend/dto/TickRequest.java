package com.moneyflow.backend.dto;

import com.moneyflow.backend.model.Observation;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TickRequest {

    @NotBlank
    private String symbol;

    private Instant timestamp;

    @NotNull
    private Double value;

    private Long volume;
    private Double bid;
    private Double ask;
    private Double open;
    private Double high;
    private Double low;
    private Double close;
    private Map<String, Object> metadata;

    public Observation toObservation() {
        Observation.ObservationBuilder builder = Observation.builder()
                .symbol(Observation.normalizeSymbol(symbol))
                .timestamp(timestamp)
                .value(value == null ? Double.NaN : value)
                .volume(volume)
                .bid(bid)
                .ask(ask)
                .open(open)
                .high(high)
                .low(low)
                .close(close);
        if (metadata != null) {
            builder.metadata(metadata);
        }
        return builder.build();
    }
}
