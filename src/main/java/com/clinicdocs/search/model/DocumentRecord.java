package com.clinicdocs.search.model;

import lombok.Builder;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One persisted unit per uploaded file.
 * <p>
 * Instances are immutable; pipeline steps derive successors through {@link #transitionTo}
 * and the {@code with*} helpers, which enforce the status order and keep {@code updatedAt}
 * from moving backwards.
 */
@Builder(toBuilder = true)
public record DocumentRecord(
    UUID id,
    UUID processingId,
    UUID batchId,
    Integer batchIndex,
    String filename,
    String contentType,
    long fileSize,
    String ownerUserId,
    String description,
    List<String> tags,
    StorageLocation storage,
    String extractedText,
    OcrSummary ocrSummary,
    String expediente,
    String nombrePaciente,
    String normalizedPatientName,
    String numeroEpisodio,
    String categoria,
    boolean medicalInfoValid,
    String medicalInfoError,
    ProcessingStatus processingStatus,
    String errorMessage,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {
    public DocumentRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(processingStatus, "processingStatus");
        tags = tags == null ? List.of() : List.copyOf(tags);
        ocrSummary = ocrSummary == null ? OcrSummary.notExtracted() : ocrSummary;
        if (medicalInfoValid != (normalizedPatientName != null)) {
            throw new IllegalArgumentException(
                "normalizedPatientName must be present exactly when medical info is valid (document " + id + ")");
        }
        if (createdAt != null && updatedAt != null && updatedAt.isBefore(createdAt)) {
            throw new IllegalArgumentException("updatedAt precedes createdAt for document " + id);
        }
    }

    public DocumentRecord transitionTo(ProcessingStatus next, OffsetDateTime at) {
        if (!processingStatus.canTransitionTo(next)) {
            throw new IllegalStateException(
                "Document %s cannot move from %s to %s".formatted(id, processingStatus, next));
        }
        return toBuilder()
            .processingStatus(next)
            .updatedAt(laterOf(at))
            .build();
    }

    public DocumentRecord withStorage(StorageLocation location, OffsetDateTime at) {
        if (storage != null) {
            throw new IllegalStateException("Storage location of document " + id + " is already set");
        }
        return toBuilder()
            .storage(Objects.requireNonNull(location, "location"))
            .build()
            .transitionTo(ProcessingStatus.UPLOADED, at);
    }

    public boolean isStored() {
        return storage != null;
    }

    private OffsetDateTime laterOf(OffsetDateTime at) {
        if (updatedAt == null || (at != null && at.isAfter(updatedAt))) {
            return at;
        }
        return updatedAt;
    }
}
