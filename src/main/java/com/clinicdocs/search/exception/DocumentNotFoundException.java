package com.clinicdocs.search.exception;

import com.clinicdocs.search.model.ErrorKind;
import lombok.Getter;

import java.util.UUID;

@Getter
public class DocumentNotFoundException extends DocumentServiceException {
    private final UUID documentId;

    public DocumentNotFoundException(UUID documentId) {
        super(ErrorKind.NOT_FOUND, "Document not found: " + documentId, null);
        this.documentId = documentId;
    }
}
