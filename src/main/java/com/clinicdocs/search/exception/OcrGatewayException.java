package com.clinicdocs.search.exception;

import com.clinicdocs.search.model.ErrorKind;

public class OcrGatewayException extends DocumentServiceException {

    public OcrGatewayException(String message, Throwable cause) {
        super(ErrorKind.OCR, message, "Check that the file is a readable scan or PDF", cause);
    }

    public OcrGatewayException(String message) {
        super(ErrorKind.OCR, message, "Check that the file is a readable scan or PDF");
    }
}
