package com.example.netconfig.export;

import com.example.netconfig.domain.NetworkConfiguration;
import com.example.netconfig.domain.NeuronLayer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured view consumed by the visualizer front end:
 * <pre>
 * { "status": "success",
 *   "network": { "structure": {...}, "connections": [ {from_layer, to_layer, weights}, ... ] } }
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class JsonConfigurationEncoder implements ConfigurationEncoder {

    private final ObjectMapper objectMapper;

    @Override
    public ExportFormat format() {
        return ExportFormat.JSON;
    }

    @Override
    public String encode(NetworkConfiguration config) {
        List<NeuronLayer> layers = config.layers();
        int last = layers.size() - 1;

        List<Map<String, Object>> layerViews = new ArrayList<>(layers.size());
        for (int i = 0; i < layers.size(); i++) {
            NeuronLayer layer = layers.get(i);
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("index", i);
            view.put("neurons", layer.numNeurons());
            view.put("is_input", i == 0);
            view.put("is_output", i == last);
            view.put("activation", layer.activationFunction());
            layerViews.add(view);
        }

        Map<String, Object> structure = new LinkedHashMap<>();
        structure.put("total_layers", layers.size());
        structure.put("layers", layerViews);
        structure.put("sample_size", config.sampleSize());
        structure.put("dataset_type", config.datasetType());
        structure.put("biases", config.biases());
        structure.put("computed_coordinates", config.computedCoordinates());
        structure.put("input_points", config.inputPoints());
        structure.put("target_coordinates", config.targetCoordinates());
        structure.put("training_params", config.trainingParams());

        List<Map<String, Object>> connections = new ArrayList<>();
        for (int i = 0; i < last; i++) {
            List<Double> weights = config.weightsBetween(i);
            Map<String, Object> connection = new LinkedHashMap<>();
            connection.put("from_layer", i);
            connection.put("to_layer", i + 1);
            connection.put("weights", weights == null ? List.of() : weights);
            connections.add(connection);
        }

        Map<String, Object> network = new LinkedHashMap<>();
        network.put("structure", structure);
        network.put("connections", connections);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("network", network);

        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new EncodingException("JSON encoding failed: " + e.getOriginalMessage(), e);
        }
    }
}
