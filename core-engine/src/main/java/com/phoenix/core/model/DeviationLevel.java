package com.phoenix.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How far an observed value sits from its learned baseline.
 */
public enum DeviationLevel {

    /** Score below the mild cut-off. */
    NORMAL,

    /** Score at or above 2.0 but below the strong threshold. */
    MILD,

    /** Score at or above the configured z-threshold. */
    STRONG;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
