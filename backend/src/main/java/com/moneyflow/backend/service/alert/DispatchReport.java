package com.moneyflow.backend.service.alert;

import java.util.Map;

/**
 * Outcome of fanning one alert out to its channels, keyed by channel name.
 */
public record DispatchReport(String alertId, Map<String, DeliveryStatus> results) {

    public long count(DeliveryStatus status) {
        return results.values().stream().filter(status::equals).count();
    }

    public boolean allDelivered() {
        return results.values().stream().allMatch(DeliveryStatus.DELIVERED::equals);
    }
}
