package com.example.netconfig.service;

import com.example.netconfig.domain.NetworkConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Read and replace use-cases behind the HTTP handlers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NetworkConfigurationService {

    private final ConfigurationStorageService storage;
    private final ConfigurationValidator validator;

    public NetworkConfiguration current() {
        return storage.load();
    }

    /**
     * Clears activations past the first layer, checks weight shapes and
     * overwrites the stored configuration.
     *
     * @return the configuration as persisted
     */
    public NetworkConfiguration replace(NetworkConfiguration candidate) {
        NetworkConfiguration normalized = candidate.withHiddenActivationsCleared();
        validator.validate(normalized);
        log.info("Attempting to save new configuration ({} layers, dataset={})",
                normalized.layerCount(), normalized.datasetType().value());
        storage.save(normalized);
        log.info("Successfully saved new configuration");
        return normalized;
    }
}
