package com.moneyflow.backend.service.alert;

public enum DeliveryStatus {
    DELIVERED,
    FAILED,
    TIMED_OUT
}
