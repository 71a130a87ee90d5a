package com.example.netconfig.service;

import com.example.netconfig.config.NetConfigStorageProperties;
import com.example.netconfig.domain.NetworkConfiguration;
import com.example.netconfig.storage.BlobStore;
import com.example.netconfig.storage.BucketNotFoundException;
import com.example.netconfig.storage.StorageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Loads and replaces the single stored {@link NetworkConfiguration}.
 *
 * <p>Reads are fail-soft: a missing document, a missing bucket, a stored
 * document that no longer passes validation or any storage error yields {@link NetworkConfiguration#defaults()}. Writes are not: every
 * failure reaches the caller as a {@link StorageException}.</p>
 */
@Slf4j
@Service
public class ConfigurationStorageService {

    private static final String CONTENT_TYPE = "application/json";

    private final BlobStore blobStore;
    private final ObjectMapper objectMapper;
    private final ConfigurationValidator validator;
    private final String objectName;

    public ConfigurationStorageService(BlobStore blobStore,
                                       ObjectMapper objectMapper,
                                       ConfigurationValidator validator,
                                       NetConfigStorageProperties props) {
        this.blobStore = blobStore;
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.objectName = props.getObjectName();
    }

    public NetworkConfiguration load() {
        try {
            requireBucket();
            Optional<byte[]> content = blobStore.read(objectName);
            if (content.isEmpty()) {
                log.info("No configuration found in storage, using default");
                return NetworkConfiguration.defaults();
            }
            NetworkConfiguration config = objectMapper.readValue(content.get(), NetworkConfiguration.class);
            validator.validate(config);
            log.info("Successfully loaded configuration from storage");
            return config;
        } catch (ConfigurationValidationException e) {
            log.warn("Stored configuration in {}/{} is invalid, using default: {}",
                    blobStore.bucket(), objectName, e.getMessage());
            return NetworkConfiguration.defaults();
        } catch (Exception e) {
            log.warn("Error loading configuration from {}/{}, using default", blobStore.bucket(), objectName, e);
            return NetworkConfiguration.defaults();
        }
    }

    public void save(NetworkConfiguration config) {
        byte[] document;
        try {
            document = objectMapper.writeValueAsBytes(config);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize configuration: " + e.getOriginalMessage(), e);
        }
        try {
            requireBucket();
            log.debug("Uploading configuration document ({} bytes) to {}/{}", document.length, blobStore.bucket(), objectName);
            blobStore.write(objectName, document, CONTENT_TYPE);
            log.info("Successfully saved configuration to storage");
        } catch (StorageException e) {
            log.error("Error saving configuration to {}/{}: {}", blobStore.bucket(), objectName, e.getMessage());
            throw e;
        }
    }

    private void requireBucket() {
        if (!blobStore.bucketExists()) {
            log.error("Bucket {} does not exist", blobStore.bucket());
            throw new BucketNotFoundException(blobStore.bucket());
        }
    }
}
