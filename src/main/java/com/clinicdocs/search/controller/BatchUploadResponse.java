package com.clinicdocs.search.controller;

import com.clinicdocs.search.model.BatchFileOutcome;
import com.clinicdocs.search.model.BatchRecord;
import com.clinicdocs.search.model.BatchStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record BatchUploadResponse(
    @JsonProperty("batch_id") UUID batchId,
    @JsonProperty("total_files") int totalFiles,
    @JsonProperty("processed_count") int processedCount,
    @JsonProperty("failed_count") int failedCount,
    @JsonProperty("stored_count") int storedCount,
    @JsonProperty("success_rate") double successRate,
    @JsonProperty("processing_status") BatchStatus processingStatus,
    @JsonProperty("started_at") OffsetDateTime startedAt,
    @JsonProperty("duration_seconds") double durationSeconds,
    List<DocumentResponse> documents,
    @JsonProperty("failed_files") List<FailedFileResponse> failedFiles
) {
    public static BatchUploadResponse from(BatchRecord batch) {
        return new BatchUploadResponse(
            batch.batchId(),
            batch.totalFiles(),
            batch.processedCount(),
            batch.failedCount(),
            batch.storedCount(),
            batch.successRate(),
            batch.status(),
            batch.startedAt(),
            batch.durationSeconds(),
            batch.outcomes().stream()
                .filter(BatchFileOutcome::isStored)
                .map(outcome -> DocumentResponse.from(outcome.document()))
                .toList(),
            batch.outcomes().stream()
                .filter(outcome -> !outcome.isProcessed())
                .map(FailedFileResponse::from)
                .toList()
        );
    }
}
