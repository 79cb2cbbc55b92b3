package com.moneyflow.backend.service.alert;

import com.moneyflow.backend.model.Alert;

/**
 * Notified after an alert is recorded in the engine history, before it is dispatched.
 */
public interface AlertListener {

    void onAlert(Alert alert);
}
