package com.clinicdocs.search.exception;

import com.clinicdocs.search.model.ErrorKind;

/**
 * Blob storage failure. Raised only after the gateway made sure no partial object remains.
 */
public class StorageGatewayException extends DocumentServiceException {

    public StorageGatewayException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, "Retry the upload; nothing was stored for this file", cause);
    }

    public StorageGatewayException(String message) {
        super(ErrorKind.STORAGE, message, "Retry the upload; nothing was stored for this file");
    }
}
