package com.example.netconfig.export;

import com.example.netconfig.domain.NetworkConfiguration;
import com.example.netconfig.domain.NeuronLayer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Four blank-line separated sections: STRUCTURE, WEIGHTS, SAMPLE_SIZE, COORDINATES.
 * Weight values inside a row are joined with {@code |}.
 */
@Component
public class CsvConfigurationEncoder implements ConfigurationEncoder {

    @Override
    public ExportFormat format() {
        return ExportFormat.CSV;
    }

    @Override
    public String encode(NetworkConfiguration config) {
        List<String> lines = new ArrayList<>();
        List<NeuronLayer> layers = config.layers();

        lines.add("STRUCTURE");
        lines.add("layer,neurons,activation");
        for (int i = 0; i < layers.size(); i++) {
            NeuronLayer layer = layers.get(i);
            lines.add(i + "," + layer.numNeurons() + "," + ValueText.activation(layer.activationFunction()));
        }
        lines.add("");

        lines.add("WEIGHTS");
        lines.add("from_layer,to_layer,weights");
        for (int i = 0; i < layers.size() - 1; i++) {
            List<Double> weights = config.weightsBetween(i);
            if (weights != null) {
                lines.add(i + "," + (i + 1) + "," + ValueText.join(weights, "|"));
            }
        }
        lines.add("");

        lines.add("SAMPLE_SIZE");
        lines.add(ValueText.number(config.sampleSize()));
        lines.add("");

        lines.add("COORDINATES");
        for (List<Double> coord : config.computedCoordinates()) {
            lines.add(ValueText.join(coord, ","));
        }

        return String.join("\n", lines);
    }
}
