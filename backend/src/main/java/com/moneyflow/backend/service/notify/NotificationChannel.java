package com.moneyflow.backend.service.notify;

import com.moneyflow.backend.exception.NotificationException;
import com.moneyflow.backend.model.Alert;

/**
 * Delivery target for alerts.
 */
public interface NotificationChannel {

    /** Registration name used by alert routing. */
    String name();

    /**
     * Delivers the alert. Implementations must not modify it.
     *
     * @throws NotificationException when the delivery fails
     */
    void send(Alert alert);
}
