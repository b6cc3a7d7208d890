package com.clinicdocs.search;

import com.clinicdocs.search.matching.NameNormalizer;
import com.clinicdocs.search.model.DocumentRecord;
import com.clinicdocs.search.model.ProcessingStatus;
import com.clinicdocs.search.model.StorageLocation;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

public final class TestDocuments {

    public static final OffsetDateTime CREATED_AT = OffsetDateTime.of(2026, 1, 15, 10, 0, 0, 0, ZoneOffset.UTC);

    private static final NameNormalizer NORMALIZER = new NameNormalizer();

    private TestDocuments() {
    }

    public static DocumentRecord patientDocument(String patientName) {
        return patientDocument(patientName, "owner-1");
    }

    public static DocumentRecord patientDocument(String patientName, String ownerUserId) {
        UUID id = UUID.randomUUID();
        String filename = "1234567890_" + patientName + "_0000000001_EMER.pdf";
        return DocumentRecord.builder()
            .id(id)
            .processingId(UUID.randomUUID())
            .filename(filename)
            .contentType("application/pdf")
            .fileSize(1024)
            .ownerUserId(ownerUserId)
            .storage(new StorageLocation(id + ".pdf", "file:///blobs/" + id + ".pdf", "medical-documents"))
            .extractedText("Informe clinico")
            .expediente("1234567890")
            .nombrePaciente(patientName)
            .normalizedPatientName(NORMALIZER.normalize(patientName))
            .numeroEpisodio("0000000001")
            .categoria("EMER")
            .medicalInfoValid(true)
            .processingStatus(ProcessingStatus.COMPLETED)
            .createdAt(CREATED_AT)
            .updatedAt(CREATED_AT)
            .build();
    }

    public static DocumentRecord unnamedDocument(String filename) {
        return DocumentRecord.builder()
            .id(UUID.randomUUID())
            .processingId(UUID.randomUUID())
            .filename(filename)
            .contentType("application/pdf")
            .fileSize(10)
            .ownerUserId("owner-1")
            .medicalInfoValid(false)
            .medicalInfoError("Expected 4 segments")
            .processingStatus(ProcessingStatus.PENDING)
            .createdAt(CREATED_AT)
            .updatedAt(CREATED_AT)
            .build();
    }
}
