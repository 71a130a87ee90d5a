package com.example.netconfig.export;

import com.example.netconfig.domain.NetworkConfiguration;
import com.example.netconfig.domain.NeuronLayer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Same sections as the CSV export behind a three-line comment header, with a
 * derived layer type column and both neuron counts on every weight row.
 */
@Component
@RequiredArgsConstructor
public class TsvConfigurationEncoder implements ConfigurationEncoder {

    private static final String TAB = "\t";
    private static final DateTimeFormatter SECONDS = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss");
    private static final DateTimeFormatter MICROS = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS");

    private final Clock clock;

    @Override
    public ExportFormat format() {
        return ExportFormat.TSV;
    }

    @Override
    public String encode(NetworkConfiguration config) {
        List<String> lines = new ArrayList<>();
        List<NeuronLayer> layers = config.layers();
        int last = layers.size() - 1;

        lines.add("# Neural Network Configuration");
        lines.add("# Generated: " + generatedAt());
        lines.add("# Format: TSV");
        lines.add("");

        lines.add("STRUCTURE");
        lines.add(String.join(TAB, "Layer", "Neurons", "Activation", "Type"));
        for (int i = 0; i < layers.size(); i++) {
            NeuronLayer layer = layers.get(i);
            lines.add(String.join(TAB,
                    String.valueOf(i),
                    String.valueOf(layer.numNeurons()),
                    ValueText.activation(layer.activationFunction()),
                    layerType(i, last)));
        }
        lines.add("");

        lines.add("WEIGHTS");
        lines.add(String.join(TAB, "FromLayer", "ToLayer", "FromNeurons", "ToNeurons", "Values"));
        for (int i = 0; i < last; i++) {
            List<Double> weights = config.weightsBetween(i);
            if (weights != null) {
                lines.add(String.join(TAB,
                        String.valueOf(i),
                        String.valueOf(i + 1),
                        String.valueOf(layers.get(i).numNeurons()),
                        String.valueOf(layers.get(i + 1).numNeurons()),
                        ValueText.join(weights, "|")));
            }
        }
        lines.add("");

        lines.add("SAMPLE_SIZE");
        lines.add(ValueText.number(config.sampleSize()));
        lines.add("");

        lines.add("COORDINATES");
        for (List<Double> coord : config.computedCoordinates()) {
            lines.add(ValueText.join(coord, TAB));
        }

        return String.join("\n", lines);
    }

    /** Seconds always present; microseconds only when non-zero. */
    String generatedAt() {
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
        return (now.getNano() == 0 ? SECONDS : MICROS).format(now);
    }

    // input wins for a single-layer network
    static String layerType(int index, int last) {
        if (index == 0) return "input";
        if (index == last) return "output";
        return "hidden";
    }
}
