package com.formshift.core.model;

public enum ConversionOutcome {
    SUCCESS,
    PARTIAL_SUCCESS,
    FAILED,
    CANCELLED
}
