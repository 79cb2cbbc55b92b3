package com.moneyflow.backend.model;

public enum AnomalyMethod {
    STATISTICAL,
    ML,
    PATTERN
}
