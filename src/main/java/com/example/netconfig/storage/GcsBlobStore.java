package com.example.netconfig.storage;

import com.google.cloud.BaseServiceException;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;

import java.util.Optional;

/**
 * {@link BlobStore} backed by a Google Cloud Storage bucket.
 */
public class GcsBlobStore implements BlobStore {

    private final Storage storage;
    private final String bucket;

    public GcsBlobStore(Storage storage, String bucket) {
        this.storage = storage;
        this.bucket = bucket;
    }

    @Override
    public String bucket() {
        return bucket;
    }

    @Override
    public boolean bucketExists() {
        try {
            return storage.get(bucket) != null;
        } catch (BaseServiceException e) {
            throw new StorageException("Error accessing storage: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<byte[]> read(String objectName) {
        try {
            Blob blob = storage.get(BlobId.of(bucket, objectName));
            if (blob == null) {
                return Optional.empty();
            }
            return Optional.of(blob.getContent());
        } catch (BaseServiceException e) {
            throw new StorageException("Error reading gs://" + bucket + "/" + objectName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void write(String objectName, byte[] content, String contentType) {
        BlobInfo info = BlobInfo.newBuilder(BlobId.of(bucket, objectName))
                .setContentType(contentType)
                .build();
        try {
            storage.create(info, content);
        } catch (BaseServiceException e) {
            throw new StorageException("Error writing gs://" + bucket + "/" + objectName + ": " + e.getMessage(), e);
        }
    }
}
