package com.example.netconfig.config;

import com.example.netconfig.storage.BlobStore;
import com.example.netconfig.storage.FileSystemBlobStore;
import com.example.netconfig.storage.GcsBlobStore;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.nio.file.Paths;

@Slf4j
@Configuration
public class StorageConfig {

    @Bean
    @ConditionalOnProperty(prefix = "netconfig.storage", name = "backend", havingValue = "gcs", matchIfMissing = true)
    public Storage gcsStorage(NetConfigStorageProperties props) {
        StorageOptions.Builder builder = StorageOptions.newBuilder();
        if (StringUtils.hasText(props.getProjectId())) {
            builder.setProjectId(props.getProjectId());
        }
        return builder.build().getService();
    }

    @Bean
    @ConditionalOnProperty(prefix = "netconfig.storage", name = "backend", havingValue = "gcs", matchIfMissing = true)
    public BlobStore gcsBlobStore(Storage storage, NetConfigStorageProperties props) {
        log.info("Configuration store: gs://{}/{}", props.getBucket(), props.getObjectName());
        return new GcsBlobStore(storage, props.getBucket());
    }

    @Bean
    @ConditionalOnProperty(prefix = "netconfig.storage", name = "backend", havingValue = "local")
    public BlobStore localBlobStore(NetConfigStorageProperties props) {
        log.info("Configuration store: {}/{}/{}", props.getLocalRoot(), props.getBucket(), props.getObjectName());
        return new FileSystemBlobStore(Paths.get(props.getLocalRoot()), props.getBucket(), props.isCreateBucket());
    }
}
