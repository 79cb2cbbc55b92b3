package com.moneyflow.backend.service.collector;

import com.moneyflow.backend.model.Observation;

import java.util.List;

/**
 * Source of market observations polled by the pipeline scheduler.
 */
public interface MarketDataCollector {

    String name();

    /**
     * Fetches the latest observations for the given symbols. Symbols the source cannot
     * serve are left out of the result rather than failing the whole call.
     */
    List<Observation> collect(List<String> symbols);

    boolean validateConnection();
}
