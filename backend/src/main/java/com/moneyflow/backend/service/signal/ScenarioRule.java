package com.moneyflow.backend.service.signal;

import com.moneyflow.backend.model.MarketState;
import com.moneyflow.backend.model.Signal;
import com.moneyflow.backend.model.SignalSeverity;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.IntFunction;
import java.util.function.IntToDoubleFunction;

@Value
@Builder
public class ScenarioRule {

    String scenario;
    @Singular
    List<ScenarioCondition> conditions;
    int minConditions;
    IntFunction<SignalSeverity> severity;
    IntToDoubleFunction confidence;
    String recommendation;
    BiFunction<Integer, MarketState, Map<String, Object>> metadata;

    public Optional<Signal> evaluate(MarketState state, Instant timestamp) {
        List<String> triggers = new ArrayList<>();
        int met = 0;
        for (ScenarioCondition condition : conditions) {
            if (condition.test().test(state)) {
                met++;
                triggers.add(condition.trigger().apply(state));
            }
        }
        if (met < minConditions) {
            return Optional.empty();
        }
        return Optional.of(Signal.builder()
                .scenario(scenario)
                .severity(severity.apply(met))
                .confidence(Math.min(confidence.applyAsDouble(met), 1.0))
                .triggers(List.copyOf(triggers))
                .recommendation(recommendation)
                .timestamp(timestamp)
                .metadata(metadata.apply(met, state))
                .build());
    }
}
