package com.example.netconfig.export;

import com.example.netconfig.domain.NetworkConfiguration;
import com.example.netconfig.domain.NeuronLayer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * Seven {@code /}-separated positional fields:
 * <ol>
 *   <li>first layer activation or {@code none}</li>
 *   <li>layer count</li>
 *   <li>neurons per layer, {@code |}-joined</li>
 *   <li>weight blocks from the last layer pair to the first, {@code |}-terminated</li>
 *   <li>sample size</li>
 *   <li>computed coordinates, {@code |}-terminated when present</li>
 *   <li>target coordinates, {@code |}-terminated when present</li>
 * </ol>
 */
@Component
public class SimpleConfigurationEncoder implements ConfigurationEncoder {

    @Override
    public ExportFormat format() {
        return ExportFormat.SIMPLE;
    }

    @Override
    public String encode(NetworkConfiguration config) {
        List<NeuronLayer> layers = config.layers();
        List<String> parts = new ArrayList<>(7);

        parts.add(ValueText.activation(layers.get(0).activationFunction()));
        parts.add(String.valueOf(layers.size()));

        StringJoiner neurons = new StringJoiner("|");
        for (NeuronLayer layer : layers) {
            neurons.add(String.valueOf(layer.numNeurons()));
        }
        parts.add(neurons.toString());

        parts.add(weightField(config));
        parts.add(ValueText.number(config.sampleSize()));
        parts.add(coordinateField(config.computedCoordinates()));
        parts.add(coordinateField(config.targetCoordinates()));

        return String.join("/", parts);
    }

    static String weightField(NetworkConfiguration config) {
        List<NeuronLayer> layers = config.layers();
        StringJoiner blocks = new StringJoiner("|");
        for (int i = layers.size() - 2; i >= 0; i--) {
            List<Double> weights = config.weightsBetween(i);
            if (weights == null) {
                continue;
            }
            int fromNeurons = layers.get(i).numNeurons();
            int toNeurons = layers.get(i + 1).numNeurons();
            blocks.add(ValueText.join(reorderBlock(weights, fromNeurons, toNeurons), "|"));
        }
        return blocks + "|";
    }

    /**
     * Visits the flattened matrix from the last (source, target) cell back to
     * the first, then reverses what was collected. Indices past the end of a
     * short vector are skipped.
     */
    static List<Double> reorderBlock(List<Double> weights, int fromNeurons, int toNeurons) {
        List<Double> reordered = new ArrayList<>(weights.size());
        for (int from = fromNeurons - 1; from >= 0; from--) {
            for (int to = toNeurons - 1; to >= 0; to--) {
                int index = to + from * toNeurons;
                if (index < weights.size()) {
                    reordered.add(weights.get(index));
                }
            }
        }
        Collections.reverse(reordered);
        return reordered;
    }

    private static String coordinateField(List<List<Double>> coordinates) {
        if (coordinates.isEmpty()) {
            return "";
        }
        StringJoiner j = new StringJoiner("|");
        for (List<Double> coord : coordinates) {
            j.add(ValueText.join(coord, ","));
        }
        return j + "|";
    }
}
