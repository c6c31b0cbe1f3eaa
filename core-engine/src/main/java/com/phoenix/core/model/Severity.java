package com.phoenix.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Incident severity. {@code HIGH} whenever a critical component is affected.
 */
public enum Severity {
    MEDIUM,
    HIGH;

    /**
     * @return lowercase wire name, e.g. {@code "high"}
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
