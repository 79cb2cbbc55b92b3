package com.moneyflow.backend.service.signal;

import com.moneyflow.backend.model.MarketState;
import com.moneyflow.backend.model.Signal;
import com.moneyflow.backend.service.MetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class SignalGenerator {

    private final ScenarioRules scenarioRules;
    private final MetricsService metricsService;
    private final Clock clock;

    public List<Signal> generateSignals(MarketState state) {
        MarketState snapshot = state == null ? MarketState.empty() : state;
        Instant now = clock.instant();
        List<Signal> signals = new ArrayList<>();
        for (ScenarioRule rule : scenarioRules.all()) {
            rule.evaluate(snapshot, now).ifPresent(signal -> {
                signals.add(signal);
                metricsService.recordSignal(signal.getScenario());
            });
        }
        log.info("Generated {} signals", signals.size());
        return signals;
    }
}
