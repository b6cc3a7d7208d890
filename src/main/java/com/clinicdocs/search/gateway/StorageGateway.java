package com.clinicdocs.search.gateway;

import com.clinicdocs.search.exception.StorageGatewayException;
import com.clinicdocs.search.model.StorageLocation;

import java.io.InputStream;

/**
 * Blob storage capability.
 * <p>
 * {@link #put} either stores the whole object and returns its location or throws
 * {@link StorageGatewayException} with nothing left behind.
 */
public interface StorageGateway {

    StorageLocation put(byte[] content, String suggestedName, String contentType);

    /**
     * @return {@code true} if a blob was removed, {@code false} if none existed
     */
    boolean delete(String blobName);

    InputStream open(String blobName);
}
