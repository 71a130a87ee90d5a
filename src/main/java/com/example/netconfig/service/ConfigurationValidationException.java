package com.example.netconfig.service;

/**
 * A configuration that parsed fine but breaks a structural rule, such as a
 * weight vector whose length does not match its two layers.
 */
public class ConfigurationValidationException extends RuntimeException {

    public ConfigurationValidationException(String message) {
        super(message);
    }
}
