package com.clinicdocs.search.exception;

import com.clinicdocs.search.model.ErrorKind;
import lombok.Getter;

/**
 * Base of every failure raised by ingestion, document management and search.
 * The {@link ErrorKind} decides how the failure is reported at the transport boundary.
 */
@Getter
public abstract class DocumentServiceException extends RuntimeException {

    private final ErrorKind kind;
    private final String suggestion;

    protected DocumentServiceException(ErrorKind kind, String message, String suggestion) {
        super(message);
        this.kind = kind;
        this.suggestion = suggestion;
    }

    protected DocumentServiceException(ErrorKind kind, String message, String suggestion, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.suggestion = suggestion;
    }
}
