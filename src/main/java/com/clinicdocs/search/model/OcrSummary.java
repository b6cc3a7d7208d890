package com.clinicdocs.search.model;

public record OcrSummary(
    int pageCount,
    double processingTimeSeconds,
    boolean textExtracted
) {
    public static OcrSummary notExtracted() {
        return new OcrSummary(0, 0.0, false);
    }

    public static OcrSummary failed(double processingTimeSeconds) {
        return new OcrSummary(0, processingTimeSeconds, false);
    }
}
