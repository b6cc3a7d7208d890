package com.clinicdocs.search.controller;

import com.clinicdocs.search.model.DocumentStatistics;
import com.clinicdocs.search.model.ProcessingStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.TreeMap;

public record StatisticsResponse(
    @JsonProperty("total_documents") long totalDocuments,
    @JsonProperty("by_status") Map<String, Long> byStatus,
    @JsonProperty("by_categoria") Map<String, Long> byCategoria,
    @JsonProperty("valid_medical_info") long validMedicalInfo,
    @JsonProperty("invalid_medical_info") long invalidMedicalInfo,
    @JsonProperty("distinct_patients") long distinctPatients,
    @JsonProperty("total_size_bytes") long totalSizeBytes,
    @JsonProperty("average_size_bytes") double averageSizeBytes
) {
    public static StatisticsResponse from(DocumentStatistics statistics) {
        Map<String, Long> byStatus = new TreeMap<>();
        for (ProcessingStatus status : ProcessingStatus.values()) {
            byStatus.put(status.wireValue(), statistics.byStatus().getOrDefault(status, 0L));
        }
        return new StatisticsResponse(
            statistics.totalDocuments(),
            byStatus,
            new TreeMap<>(statistics.byCategoria()),
            statistics.validMedicalInfo(),
            statistics.invalidMedicalInfo(),
            statistics.distinctPatients(),
            statistics.totalSizeBytes(),
            statistics.averageSizeBytes()
        );
    }
}
