package com.clinicdocs.search.model;

import java.util.Objects;

/**
 * Where a document's bytes live. A record either has all three coordinates or none.
 */
public record StorageLocation(
    String blobName,
    String blobUrl,
    String containerName
) {
    public StorageLocation {
        Objects.requireNonNull(blobName, "blobName");
        Objects.requireNonNull(blobUrl, "blobUrl");
        Objects.requireNonNull(containerName, "containerName");
    }
}
