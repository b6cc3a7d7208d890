package com.clinicdocs.search.controller;

import com.clinicdocs.search.model.BatchFileOutcome;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.UUID;

public record FailedFileResponse(
    int index,
    String filename,

    @JsonProperty("error_type")
    String errorType,

    String error,

    boolean stored,

    @JsonProperty("document_id")
    UUID documentId
) {
    public static FailedFileResponse from(BatchFileOutcome outcome) {
        return new FailedFileResponse(
            outcome.index(),
            outcome.filename(),
            outcome.errorKind() == null ? null : outcome.errorKind().name().toLowerCase(Locale.ROOT),
            outcome.errorMessage(),
            outcome.isStored(),
            outcome.isStored() ? outcome.document().id() : null
        );
    }
}
