package com.example.netconfig.storage;

import java.util.Optional;

/**
 * Minimal get/put view of an object-storage bucket.
 *
 * <p>Implementations report infrastructure failures as {@link StorageException};
 * an object that simply does not exist is an empty {@link Optional}.</p>
 */
public interface BlobStore {

    /** Name of the bucket this store addresses. */
    String bucket();

    boolean bucketExists();

    Optional<byte[]> read(String objectName);

    /** Replaces the whole object; there is no partial update. */
    void write(String objectName, byte[] content, String contentType);
}
