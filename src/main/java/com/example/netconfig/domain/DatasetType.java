package com.example.netconfig.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Synthetic datasets the visualizer can sample training points from.
 */
public enum DatasetType {
    RANDOM,
    CIRCLE,
    XOR,
    SPIRAL,
    GAUSSIAN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DatasetType fromValue(String value) {
        for (DatasetType t : values()) {
            if (t.value().equals(value)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Invalid dataset type: " + value);
    }
}
