package com.example.netconfig.storage;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Local {@link BlobStore}: the bucket is a directory under {@code root}, each
 * object a file inside it. Writes land in a temp file first and are moved over
 * the target so readers never see a half-written document.
 */
@Slf4j
public class FileSystemBlobStore implements BlobStore {

    private final Path bucketDir;
    private final String bucket;

    public FileSystemBlobStore(Path root, String bucket, boolean createBucket) {
        this.bucket = bucket;
        this.bucketDir = root.toAbsolutePath().normalize().resolve(bucket);
        if (createBucket) {
            try {
                Files.createDirectories(bucketDir);
            } catch (IOException e) {
                throw new StorageException("Cannot create bucket directory " + bucketDir, e);
            }
        }
    }

    @Override
    public String bucket() {
        return bucket;
    }

    @Override
    public boolean bucketExists() {
        return Files.isDirectory(bucketDir);
    }

    @Override
    public Optional<byte[]> read(String objectName) {
        Path file = resolve(objectName);
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Error reading " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void write(String objectName, byte[] content, String contentType) {
        Path target = resolve(objectName);
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move unsupported for {}, falling back to replace", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageException("Error writing " + target + ": " + e.getMessage(), e);
        }
    }

    private Path resolve(String objectName) {
        Path file = bucketDir.resolve(objectName).normalize();
        if (!file.startsWith(bucketDir)) {
            throw new StorageException("Object name escapes bucket: " + objectName);
        }
        return file;
    }
}
