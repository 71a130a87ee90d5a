package com.example.netconfig.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * One layer of the network.
 *
 * @param numNeurons         neuron count, strictly positive
 * @param activationFunction activation, only kept on the first layer once persisted
 */
public record NeuronLayer(
        @JsonProperty("num_neurons") @NotNull @Positive Integer numNeurons,
        @JsonProperty("activation_function") Activation activationFunction
) {

    public NeuronLayer withoutActivation() {
        return activationFunction == null ? this : new NeuronLayer(numNeurons, null);
    }
}
