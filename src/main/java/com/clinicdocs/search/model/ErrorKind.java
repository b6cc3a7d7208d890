package com.clinicdocs.search.model;

/**
 * Closed set of failure categories surfaced by ingestion and search.
 */
public enum ErrorKind {
    VALIDATION,
    METADATA_PARSE,
    STORAGE,
    OCR,
    PERSISTENCE,
    NOT_FOUND,
    ACCESS_DENIED
}
