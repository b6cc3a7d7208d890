package com.clinicdocs.search.controller;

import com.clinicdocs.search.model.DocumentRecord;
import com.clinicdocs.search.model.MatchType;
import com.clinicdocs.search.model.ProcessingStatus;
import com.clinicdocs.search.model.ScoredDocument;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.UUID;

public record PatientMatchResponse(
    @JsonProperty("document_id") UUID documentId,
    String filename,
    String expediente,
    @JsonProperty("nombre_paciente") String nombrePaciente,
    @JsonProperty("normalized_patient_name") String normalizedPatientName,
    @JsonProperty("numero_episodio") String numeroEpisodio,
    String categoria,
    @JsonProperty("processing_status") ProcessingStatus processingStatus,
    @JsonProperty("similarity_score") double similarityScore,
    @JsonProperty("match_type") MatchType matchType,
    @JsonProperty("created_at") OffsetDateTime createdAt
) {
    public static PatientMatchResponse from(ScoredDocument scored) {
        DocumentRecord document = scored.document();
        return new PatientMatchResponse(
            document.id(),
            document.filename(),
            document.expediente(),
            document.nombrePaciente(),
            document.normalizedPatientName(),
            document.numeroEpisodio(),
            document.categoria(),
            document.processingStatus(),
            Math.round(scored.score() * 1000) / 1000.0,
            scored.matchType(),
            document.createdAt()
        );
    }
}
