package com.clinicdocs.search.gateway;

public record OcrResult(
    String text,
    int pageCount,
    double processingTimeSeconds
) {}
