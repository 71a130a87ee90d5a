package com.example.netconfig.export;

import com.example.netconfig.domain.NetworkConfiguration;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes a configuration to the encoder registered for the requested format.
 */
@Service
public class ConfigurationExporter {

    private final Map<ExportFormat, ConfigurationEncoder> encoders = new EnumMap<>(ExportFormat.class);

    public ConfigurationExporter(List<ConfigurationEncoder> encoders) {
        for (ConfigurationEncoder e : encoders) {
            ConfigurationEncoder previous = this.encoders.put(e.format(), e);
            if (previous != null) {
                throw new IllegalStateException("Duplicate encoder for " + e.format() + ": "
                        + previous.getClass().getName() + ", " + e.getClass().getName());
            }
        }
    }

    public String export(NetworkConfiguration config, ExportFormat format) {
        ConfigurationEncoder encoder = encoders.get(format);
        if (encoder == null) {
            throw new IllegalStateException("No encoder registered for " + format);
        }
        return encoder.encode(config);
    }
}
