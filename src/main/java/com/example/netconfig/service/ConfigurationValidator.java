package com.example.netconfig.service;

import com.example.netconfig.domain.NetworkConfiguration;
import com.example.netconfig.domain.NeuronLayer;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks a configuration before it is saved or served: field constraints
 * first, then the cross-field rules they cannot express.
 */
@Component
@RequiredArgsConstructor
public class ConfigurationValidator {

    private final Validator beanValidator;

    public void validate(NetworkConfiguration config) {
        if (config.layers() == null || config.layers().isEmpty()) {
            throw new ConfigurationValidationException("Configuration must declare at least one layer");
        }
        Set<ConstraintViolation<NetworkConfiguration>> violations = beanValidator.validate(config);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ConfigurationValidationException("Invalid configuration: " + details);
        }
        for (int i = 0; i < config.layerCount(); i++) {
            NeuronLayer layer = config.layers().get(i);
            if (layer == null || layer.numNeurons() == null || layer.numNeurons() <= 0) {
                throw new ConfigurationValidationException("Layer " + i + " must have a positive number of neurons");
            }
        }
        for (int i = 0; i < config.layerCount() - 1; i++) {
            List<Double> weights = config.weightsBetween(i);
            if (weights == null) {
                continue;
            }
            // long: two large layers overflow int
            long expected = (long) config.layers().get(i).numNeurons() * config.layers().get(i + 1).numNeurons();
            if (weights.size() != expected) {
                throw new ConfigurationValidationException(
                        "Invalid number of weights for " + NetworkConfiguration.layerPairKey(i)
                                + ". Expected " + expected + ", got " + weights.size());
            }
        }
        if (config.datasetType() == null) {
            throw new ConfigurationValidationException("Invalid dataset type: null");
        }
    }
}
