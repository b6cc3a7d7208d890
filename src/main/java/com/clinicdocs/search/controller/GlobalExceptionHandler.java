package com.clinicdocs.search.controller;

import com.clinicdocs.search.exception.DocumentAccessDeniedException;
import com.clinicdocs.search.exception.DocumentServiceException;
import com.clinicdocs.search.model.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(DocumentServiceException.class)
    public ResponseEntity<ErrorResponse> handleDocumentServiceException(DocumentServiceException ex) {
        HttpStatus status;
        String errorCode;
        String message = ex.getMessage();

        switch (ex.getKind()) {
            case VALIDATION, METADATA_PARSE -> {
                status = HttpStatus.BAD_REQUEST;
                errorCode = "VALIDATION_ERROR";
            }
            case NOT_FOUND -> {
                status = HttpStatus.NOT_FOUND;
                errorCode = "RESOURCE_NOT_FOUND";
            }
            case ACCESS_DENIED -> {
                // reported exactly like a missing document
                status = HttpStatus.NOT_FOUND;
                errorCode = "RESOURCE_NOT_FOUND";
                message = ex instanceof DocumentAccessDeniedException denied
                    ? "Document not found: " + denied.getDocumentId()
                    : "Document not found";
            }
            case STORAGE -> {
                status = HttpStatus.BAD_GATEWAY;
                errorCode = "STORAGE_ERROR";
            }
            case OCR -> {
                status = HttpStatus.BAD_GATEWAY;
                errorCode = "OCR_ERROR";
            }
            case PERSISTENCE -> {
                status = HttpStatus.SERVICE_UNAVAILABLE;
                errorCode = "PERSISTENCE_ERROR";
            }
            default -> {
                status = HttpStatus.INTERNAL_SERVER_ERROR;
                errorCode = "INTERNAL_ERROR";
            }
        }

        String suggestion = ex.getKind() == ErrorKind.ACCESS_DENIED ? null : ex.getSuggestion();
        return error(message, errorCode, suggestion, status);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParams(MissingServletRequestParameterException ex) {
        return error(String.format("Parameter '%s' is missing", ex.getParameterName()),
            "VALIDATION_ERROR", null, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException ex) {
        return error(String.format("Part '%s' is missing", ex.getRequestPartName()),
            "VALIDATION_ERROR", null, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return error(String.format("Parameter '%s' has an invalid value", ex.getName()),
            "VALIDATION_ERROR", null, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        return error("Upload exceeds the maximum allowed size", "VALIDATION_ERROR",
            "Compress or split the document", HttpStatus.PAYLOAD_TOO_LARGE);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled error", ex);
        return error("An unexpected error occurred", "INTERNAL_ERROR", null, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ResponseEntity<ErrorResponse> error(String message, String errorCode, String suggestion, HttpStatus status) {
        ErrorResponse body = new ErrorResponse(
            message,
            errorCode,
            suggestion,
            status.value(),
            Instant.now().toEpochMilli()
        );
        return new ResponseEntity<>(body, status);
    }
}
