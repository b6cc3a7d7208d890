package com.clinicdocs.search.exception;

import com.clinicdocs.search.model.ErrorKind;

public class PersistenceException extends DocumentServiceException {

    public PersistenceException(String message, Throwable cause) {
        super(ErrorKind.PERSISTENCE, message, "Retry the whole request", cause);
    }
}
