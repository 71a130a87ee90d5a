package com.example.netconfig.storage;

/**
 * Raised when the backing object store cannot serve a read or accept a write.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
