package com.clinicdocs.search.controller;

import com.clinicdocs.search.model.DocumentRecord;
import com.clinicdocs.search.model.ProcessingStatus;
import com.clinicdocs.search.model.StorageLocation;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record DocumentResponse(
    UUID id,

    @JsonProperty("processing_id")
    UUID processingId,

    @JsonProperty("batch_id")
    UUID batchId,

    @JsonProperty("batch_index")
    Integer batchIndex,

    String filename,

    @JsonProperty("content_type")
    String contentType,

    @JsonProperty("file_size")
    long fileSize,

    @JsonProperty("user_id")
    String userId,

    String description,

    List<String> tags,

    @JsonProperty("blob_name")
    String blobName,

    @JsonProperty("blob_url")
    String blobUrl,

    @JsonProperty("container_name")
    String containerName,

    @JsonProperty("extracted_text")
    String extractedText,

    @JsonProperty("page_count")
    int pageCount,

    @JsonProperty("processing_time")
    double processingTime,

    @JsonProperty("text_extracted")
    boolean textExtracted,

    @JsonProperty("medical_info")
    MedicalInfoResponse medicalInfo,

    @JsonProperty("processing_status")
    ProcessingStatus processingStatus,

    @JsonProperty("error_message")
    String errorMessage,

    @JsonProperty("created_at")
    OffsetDateTime createdAt,

    @JsonProperty("updated_at")
    OffsetDateTime updatedAt
) {
    public static DocumentResponse from(DocumentRecord document) {
        StorageLocation storage = document.storage();
        return new DocumentResponse(
            document.id(),
            document.processingId(),
            document.batchId(),
            document.batchIndex(),
            document.filename(),
            document.contentType(),
            document.fileSize(),
            document.ownerUserId(),
            document.description(),
            document.tags(),
            storage == null ? null : storage.blobName(),
            storage == null ? null : storage.blobUrl(),
            storage == null ? null : storage.containerName(),
            document.extractedText(),
            document.ocrSummary().pageCount(),
            document.ocrSummary().processingTimeSeconds(),
            document.ocrSummary().textExtracted(),
            MedicalInfoResponse.from(document),
            document.processingStatus(),
            document.errorMessage(),
            document.createdAt(),
            document.updatedAt()
        );
    }
}
