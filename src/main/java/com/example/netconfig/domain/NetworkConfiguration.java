package com.example.netconfig.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The single live network description: layer structure, weights keyed by
 * adjacent layer pair, biases, dataset selection and the coordinate arrays the
 * visualizer produced.
 *
 * <p>Absent optional fields are replaced by their defaults on construction, so
 * a value read back from storage compares equal to the one that was written.</p>
 */
public record NetworkConfiguration(
        @JsonProperty("layers") @NotNull @Size(min = 1) List<@Valid @NotNull NeuronLayer> layers,
        @JsonProperty("weights") Map<String, @NotNull List<@NotNull Double>> weights,
        @JsonProperty("biases") List<@NotNull List<@NotNull Double>> biases,
        @JsonProperty("sample_size") @Positive Integer sampleSize,
        @JsonProperty("dataset_type") DatasetType datasetType,
        @JsonProperty("computed_coordinates") List<@NotNull List<@NotNull Double>> computedCoordinates,
        @JsonProperty("input_points") List<@NotNull List<@NotNull Double>> inputPoints,
        @JsonProperty("target_coordinates") List<@NotNull List<@NotNull Double>> targetCoordinates,
        @JsonProperty("training_params") @Valid TrainingParameters trainingParams
) {

    public static final int DEFAULT_SAMPLE_SIZE = 100;

    public NetworkConfiguration {
        layers = layers == null ? null : Collections.unmodifiableList(new ArrayList<>(layers));
        weights = weights == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        biases = immutable(biases);
        if (sampleSize == null) sampleSize = DEFAULT_SAMPLE_SIZE;
        if (datasetType == null) datasetType = DatasetType.RANDOM;
        computedCoordinates = immutable(computedCoordinates);
        inputPoints = immutable(inputPoints);
        targetCoordinates = immutable(targetCoordinates);
        if (trainingParams == null) trainingParams = TrainingParameters.defaults();
    }

    /** Key of the weight vector between layer {@code from} and {@code from + 1}. */
    public static String layerPairKey(int from) {
        return "layer" + from + "_" + (from + 1);
    }

    public int layerCount() {
        return layers == null ? 0 : layers.size();
    }

    /** Stored weights between layer {@code from} and the next one, or {@code null} when none are stored. */
    public List<Double> weightsBetween(int from) {
        return weights.get(layerPairKey(from));
    }

    /**
     * Copy in which every layer after the first carries no activation function.
     */
    public NetworkConfiguration withHiddenActivationsCleared() {
        if (layers == null || layers.size() < 2) {
            return this;
        }
        List<NeuronLayer> cleared = new ArrayList<>(layers.size());
        cleared.add(layers.get(0));
        for (int i = 1; i < layers.size(); i++) {
            NeuronLayer layer = layers.get(i);
            cleared.add(layer == null ? null : layer.withoutActivation());
        }
        return new NetworkConfiguration(cleared, weights, biases, sampleSize, datasetType,
                computedCoordinates, inputPoints, targetCoordinates, trainingParams);
    }

    /**
     * Configuration served when nothing is stored yet or storage cannot be read:
     * a 2-neuron relu input layer feeding a 3-neuron layer.
     */
    public static NetworkConfiguration defaults() {
        return new NetworkConfiguration(
                List.of(new NeuronLayer(2, Activation.RELU), new NeuronLayer(3, null)),
                Map.of(layerPairKey(0), List.of(0.1, 0.2, 0.3, 0.4, 0.5, 0.6)),
                null, null, null, null, null, null,
                TrainingParameters.defaults());
    }

    private static <T> List<T> immutable(List<T> in) {
        return in == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(in));
    }
}
