package com.example.netconfig.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Activation functions a layer may declare.
 */
public enum Activation {
    RELU,
    SIGMOID,
    TANH,
    LINEAR;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Activation fromValue(String value) {
        for (Activation a : values()) {
            if (a.value().equals(value)) {
                return a;
            }
        }
        throw new IllegalArgumentException("Invalid activation function: " + value);
    }
}
