package com.clinicdocs.search.controller;

import com.clinicdocs.search.model.DocumentRecord;
import com.clinicdocs.search.model.MedicalCategory;
import com.fasterxml.jackson.annotation.JsonProperty;

public record MedicalInfoResponse(
    String expediente,

    @JsonProperty("nombre_paciente")
    String nombrePaciente,

    @JsonProperty("normalized_patient_name")
    String normalizedPatientName,

    @JsonProperty("numero_episodio")
    String numeroEpisodio,

    String categoria,

    @JsonProperty("categoria_description")
    String categoriaDescription,

    boolean valid,

    String error
) {
    public static MedicalInfoResponse from(DocumentRecord document) {
        String description = document.categoria() == null
            ? null
            : MedicalCategory.fromCode(document.categoria().trim()).map(MedicalCategory::getDescription).orElse(null);
        return new MedicalInfoResponse(
            document.expediente(),
            document.nombrePaciente(),
            document.normalizedPatientName(),
            document.numeroEpisodio(),
            document.categoria(),
            description,
            document.medicalInfoValid(),
            document.medicalInfoError()
        );
    }
}
