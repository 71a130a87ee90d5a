package com.example.netconfig.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Where the live configuration document is kept. Binds to the
 * {@code netconfig.storage} prefix.
 */
@ConfigurationProperties(prefix = "netconfig.storage")
@Validated
@Getter @Setter
public class NetConfigStorageProperties {

    public enum Backend {
        GCS,
        LOCAL
    }

    /** Object store implementation. */
    @NotNull
    private Backend backend = Backend.GCS;

    /** Google Cloud project that owns the bucket. */
    private String projectId = "neural-network-config";

    @NotBlank
    private String bucket = "neural-network-config-neural-network-config";

    /** Key of the single stored document. */
    @NotBlank
    private String objectName = "current_config.json";

    /** Parent directory of the bucket directory, local backend only. */
    private String localRoot = "./data";

    /**
     * Create the bucket directory at startup when it is missing (local backend only).
     * Left off, a missing bucket fails reads and writes the same way a missing GCS bucket does.
     */
    private boolean createBucket = false;
}
