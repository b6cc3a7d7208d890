package com.clinicdocs.search.model;

import java.util.Map;

public record DocumentStatistics(
    long totalDocuments,
    Map<ProcessingStatus, Long> byStatus,
    Map<String, Long> byCategoria,
    long validMedicalInfo,
    long invalidMedicalInfo,
    long distinctPatients,
    long totalSizeBytes,
    double averageSizeBytes
) {
    public DocumentStatistics {
        byStatus = Map.copyOf(byStatus);
        byCategoria = Map.copyOf(byCategoria);
    }
}
