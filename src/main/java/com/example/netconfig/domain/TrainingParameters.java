package com.example.netconfig.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Training hyperparameters. Missing values fall back to their defaults.
 */
public record TrainingParameters(
        @JsonProperty("learning_rate") @DecimalMin("0.0001") @DecimalMax("1.0") Double learningRate,
        @JsonProperty("epochs") @Min(1) @Max(1000) Integer epochs,
        @JsonProperty("batch_size") @Min(1) @Max(1000) Integer batchSize,
        @JsonProperty("l2_factor") @DecimalMin("0.0") @DecimalMax("1.0") Double l2Factor
) {

    public static final double DEFAULT_LEARNING_RATE = 0.01;
    public static final int DEFAULT_EPOCHS = 100;
    public static final int DEFAULT_BATCH_SIZE = 32;
    public static final double DEFAULT_L2_FACTOR = 0.00005;

    public TrainingParameters {
        if (learningRate == null) learningRate = DEFAULT_LEARNING_RATE;
        if (epochs == null) epochs = DEFAULT_EPOCHS;
        if (batchSize == null) batchSize = DEFAULT_BATCH_SIZE;
        if (l2Factor == null) l2Factor = DEFAULT_L2_FACTOR;
    }

    public static TrainingParameters defaults() {
        return new TrainingParameters(null, null, null, null);
    }
}
