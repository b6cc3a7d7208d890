package com.clinicdocs.search.gateway;

import com.clinicdocs.search.exception.StorageGatewayException;
import com.clinicdocs.search.model.StorageLocation;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Stores blobs as files under {@code <root-dir>/<container-name>}. Content is written to a
 * temporary file first and moved into place atomically, so a failed put leaves nothing visible.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.storage.type", havingValue = "local", matchIfMissing = true)
public class FileSystemStorageGateway implements StorageGateway {

    @Getter
    private final Path containerLocation;
    private final String containerName;

    public FileSystemStorageGateway(
        @Value("${app.storage.local.root-dir:./data/blobs}") String rootDir,
        @Value("${app.storage.container-name:medical-documents}") String containerName) {
        this.containerName = containerName;
        this.containerLocation = Paths.get(rootDir).resolve(BlobNames.sanitize(containerName)).toAbsolutePath().normalize();
        try {
            Files.createDirectories(containerLocation);
            log.info("Local blob storage initialized at: {}", containerLocation);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not initialize storage at " + containerLocation, e);
        }
    }

    @Override
    public StorageLocation put(byte[] content, String suggestedName, String contentType) {
        String blobName = BlobNames.sanitize(suggestedName);
        Path target = resolve(blobName);
        Path temp = null;
        try {
            temp = Files.createTempFile(containerLocation, ".upload-", ".part");
            Files.write(temp, content);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            log.info("Stored blob {} ({} bytes)", blobName, content.length);
            return new StorageLocation(blobName, target.toUri().toString(), containerName);
        } catch (IOException e) {
            removeTemp(temp);
            throw new StorageGatewayException("Could not store blob " + blobName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean delete(String blobName) {
        Path path = resolve(blobName);
        try {
            boolean deleted = Files.deleteIfExists(path);
            if (deleted) {
                log.info("Deleted blob {}", blobName);
            } else {
                log.warn("Blob {} not found for deletion, presumed already deleted", blobName);
            }
            return deleted;
        } catch (IOException e) {
            throw new StorageGatewayException("Could not delete blob " + blobName, e);
        }
    }

    @Override
    public InputStream open(String blobName) {
        try {
            return Files.newInputStream(resolve(blobName));
        } catch (NoSuchFileException e) {
            throw new StorageGatewayException("Blob not found: " + blobName, e);
        } catch (IOException e) {
            throw new StorageGatewayException("Could not read blob " + blobName, e);
        }
    }

    private Path resolve(String blobName) {
        Path path = containerLocation.resolve(blobName).normalize();
        if (!path.getParent().equals(containerLocation)) {
            throw new StorageGatewayException("Blob name escapes the container: " + blobName);
        }
        return path;
    }

    private void removeTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanupError) {
            log.error("Could not remove partial upload {}", temp, cleanupError);
        }
    }
}
