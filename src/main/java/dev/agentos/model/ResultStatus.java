package dev.agentos.model;

public enum ResultStatus {
    SUCCESS,
    FAILURE,
    SKIPPED
}
