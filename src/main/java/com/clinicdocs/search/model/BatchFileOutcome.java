package com.clinicdocs.search.model;

/**
 * Result of one file inside a batch. {@code document} is set whenever a record was stored,
 * including documents whose OCR failed; {@code errorKind} is set whenever the file did not
 * reach {@link ProcessingStatus#COMPLETED}.
 */
public record BatchFileOutcome(
    int index,
    String filename,
    DocumentRecord document,
    ErrorKind errorKind,
    String errorMessage
) {
    public static BatchFileOutcome stored(int index, DocumentRecord document) {
        if (document.processingStatus() == ProcessingStatus.FAILED) {
            return new BatchFileOutcome(index, document.filename(), document, ErrorKind.OCR, document.errorMessage());
        }
        return new BatchFileOutcome(index, document.filename(), document, null, null);
    }

    public static BatchFileOutcome rejected(int index, String filename, ErrorKind kind, String message) {
        return new BatchFileOutcome(index, filename, null, kind, message);
    }

    public boolean isStored() {
        return document != null;
    }

    public boolean isProcessed() {
        return document != null && document.processingStatus() == ProcessingStatus.COMPLETED;
    }
}
