package com.moneyflow.backend.service.signal;

import com.moneyflow.backend.model.MarketState;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One check of a scenario rule. The trigger text is only rendered when the check passes.
 */
public record ScenarioCondition(
        String name,
        Predicate<MarketState> test,
        Function<MarketState, String> trigger
) {
}
