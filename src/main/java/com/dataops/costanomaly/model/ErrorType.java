package com.dataops.costanomaly.model;

public enum ErrorType {
    VALIDATION_ERROR,
    INSUFFICIENT_DATA,
    PROVIDER_ERROR,
    INTERNAL_ERROR
}
