package com.moneyflow.backend.service;

import com.moneyflow.backend.model.MarketState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Latest market indicator snapshot fed to signal generation and risk scoring.
 */
@Component
@Slf4j
public class MarketStateStore {

    private final AtomicReference<MarketState> current = new AtomicReference<>(MarketState.empty());

    public MarketState snapshot() {
        return current.get();
    }

    /** Overlays the given indicators; a null value removes the key. */
    public MarketState merge(Map<String, ?> updates) {
        MarketState merged = current.updateAndGet(state -> state.merge(updates));
        log.debug("Market state now holds {} indicators", merged.asMap().size());
        return merged;
    }

    public MarketState replace(Map<String, ?> values) {
        MarketState replaced = MarketState.of(values);
        current.set(replaced);
        return replaced;
    }
}
