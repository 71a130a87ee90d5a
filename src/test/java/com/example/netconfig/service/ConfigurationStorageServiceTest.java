package com.example.netconfig.service;

import com.example.netconfig.TestConfigurations;
import com.example.netconfig.config.NetConfigStorageProperties;
import com.example.netconfig.domain.NetworkConfiguration;
import com.example.netconfig.storage.BlobStore;
import com.example.netconfig.storage.BucketNotFoundException;
import com.example.netconfig.storage.FileSystemBlobStore;
import com.example.netconfig.storage.StorageException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConfigurationStorageServiceTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final NetConfigStorageProperties props = new NetConfigStorageProperties();
    private BlobStore blobStore;
    private ConfigurationStorageService service;

    @BeforeEach
    void setUp() {
        blobStore = mock(BlobStore.class);
        when(blobStore.bucket()).thenReturn("test-bucket");
        service = new ConfigurationStorageService(blobStore, mapper, TestConfigurations.validator(), props);
    }

    @Test
    void load_returns_default_when_object_absent() {
        when(blobStore.bucketExists()).thenReturn(true);
        when(blobStore.read("current_config.json")).thenReturn(Optional.empty());

        assertThat(service.load()).isEqualTo(NetworkConfiguration.defaults());
    }

    @Test
    void load_returns_default_when_bucket_missing() {
        when(blobStore.bucketExists()).thenReturn(false);

        assertThat(service.load()).isEqualTo(NetworkConfiguration.defaults());
        verify(blobStore, never()).read(anyString());
    }

    @Test
    void load_returns_default_when_read_fails() {
        when(blobStore.bucketExists()).thenReturn(true);
        when(blobStore.read(anyString())).thenThrow(new StorageException("permission denied"));

        assertThat(service.load()).isEqualTo(NetworkConfiguration.defaults());
    }

    @Test
    void load_returns_default_when_document_is_corrupt() {
        when(blobStore.bucketExists()).thenReturn(true);
        when(blobStore.read(anyString())).thenReturn(Optional.of("{not json".getBytes(StandardCharsets.UTF_8)));

        assertThat(service.load()).isEqualTo(NetworkConfiguration.defaults());
    }

    @Test
    void load_parses_stored_document() throws Exception {
        NetworkConfiguration stored = TestConfigurations.threeLayer();
        when(blobStore.bucketExists()).thenReturn(true);
        when(blobStore.read("current_config.json")).thenReturn(Optional.of(mapper.writeValueAsBytes(stored)));

        assertThat(service.load()).isEqualTo(stored);
    }

    @Test
    void save_uploads_json_under_the_fixed_key() throws Exception {
        when(blobStore.bucketExists()).thenReturn(true);
        NetworkConfiguration config = TestConfigurations.threeLayer();

        service.save(config);

        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(blobStore).write(eq("current_config.json"), body.capture(), eq("application/json"));
        assertThat(mapper.readValue(body.getValue(), NetworkConfiguration.class)).isEqualTo(config);
    }

    @Test
    void save_fails_loudly_when_bucket_missing() {
        when(blobStore.bucketExists()).thenReturn(false);

        assertThatThrownBy(() -> service.save(NetworkConfiguration.defaults()))
                .isInstanceOf(BucketNotFoundException.class)
                .hasMessageContaining("test-bucket");
        verify(blobStore, never()).write(anyString(), any(), anyString());
    }

    @Test
    void save_propagates_upload_failure() {
        when(blobStore.bucketExists()).thenReturn(true);
        doThrow(new StorageException("upload refused"))
                .when(blobStore).write(anyString(), any(), anyString());

        assertThatThrownBy(() -> service.save(NetworkConfiguration.defaults()))
                .isInstanceOf(StorageException.class)
                .hasMessage("upload refused");
    }

    @Test
    void save_then_load_round_trips_on_disk(@TempDir Path root) {
        ConfigurationStorageService onDisk = new ConfigurationStorageService(
                new FileSystemBlobStore(root, "bucket", true), mapper, TestConfigurations.validator(), props);
        NetworkConfiguration config = TestConfigurations.threeLayer();

        onDisk.save(config);

        assertThat(onDisk.load()).isEqualTo(config);
    }

    @Test
    void load_returns_default_when_stored_document_is_empty_object() {
        when(blobStore.bucketExists()).thenReturn(true);
        when(blobStore.read(anyString())).thenReturn(Optional.of("{}".getBytes(StandardCharsets.UTF_8)));

        assertThat(service.load()).isEqualTo(NetworkConfiguration.defaults());
    }

    @Test
    void load_returns_default_when_stored_values_are_out_of_range() {
        String stored = "{\"layers\":[{\"num_neurons\":-5}],\"training_params\":{\"epochs\":99999}}";
        when(blobStore.bucketExists()).thenReturn(true);
        when(blobStore.read(anyString())).thenReturn(Optional.of(stored.getBytes(StandardCharsets.UTF_8)));

        assertThat(service.load()).isEqualTo(NetworkConfiguration.defaults());
    }

    @Test
    void load_returns_default_when_stored_coordinates_contain_null() {
        String stored = "{\"layers\":[{\"num_neurons\":2}],\"computed_coordinates\":[null]}";
        when(blobStore.bucketExists()).thenReturn(true);
        when(blobStore.read(anyString())).thenReturn(Optional.of(stored.getBytes(StandardCharsets.UTF_8)));

        assertThat(service.load()).isEqualTo(NetworkConfiguration.defaults());
    }

    @Test
    void load_returns_default_when_stored_weights_have_wrong_length() {
        String stored = "{\"layers\":[{\"num_neurons\":2},{\"num_neurons\":2}],\"weights\":{\"layer0_1\":[1.0]}}";
        when(blobStore.bucketExists()).thenReturn(true);
        when(blobStore.read(anyString())).thenReturn(Optional.of(stored.getBytes(StandardCharsets.UTF_8)));

        assertThat(service.load()).isEqualTo(NetworkConfiguration.defaults());
    }
}
