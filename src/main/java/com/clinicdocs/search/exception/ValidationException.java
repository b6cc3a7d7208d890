package com.clinicdocs.search.exception;

import com.clinicdocs.search.model.ErrorKind;

public class ValidationException extends DocumentServiceException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message, null);
    }

    public ValidationException(String message, String suggestion) {
        super(ErrorKind.VALIDATION, message, suggestion);
    }
}
