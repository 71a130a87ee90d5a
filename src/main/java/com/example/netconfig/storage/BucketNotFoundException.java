package com.example.netconfig.storage;

public class BucketNotFoundException extends StorageException {

    private final String bucket;

    public BucketNotFoundException(String bucket) {
        super("Storage bucket " + bucket + " not found");
        this.bucket = bucket;
    }

    public String getBucket() {
        return bucket;
    }
}
