package com.moneyflow.backend.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class Observation {

    String symbol;
    Instant timestamp;
    double value;
    Long volume;
    Double bid;
    Double ask;
    Double open;
    Double high;
    Double low;
    Double close;
    @Singular("metadataEntry")
    Map<String, Object> metadata;

    public static String normalizeSymbol(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase();
    }

    public boolean isValid() {
        return symbol != null && !symbol.isBlank() && Double.isFinite(value);
    }
}
