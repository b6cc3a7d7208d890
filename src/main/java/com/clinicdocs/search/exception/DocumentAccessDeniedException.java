package com.clinicdocs.search.exception;

import com.clinicdocs.search.model.ErrorKind;
import lombok.Getter;

import java.util.UUID;

@Getter
public class DocumentAccessDeniedException extends DocumentServiceException {
    private final UUID documentId;
    private final String requesterUserId;

    public DocumentAccessDeniedException(UUID documentId, String requesterUserId) {
        super(ErrorKind.ACCESS_DENIED, "Document " + documentId + " does not belong to user " + requesterUserId, null);
        this.documentId = documentId;
        this.requesterUserId = requesterUserId;
    }
}
