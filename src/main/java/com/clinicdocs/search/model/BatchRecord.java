package com.clinicdocs.search.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Aggregate describing one batch upload call. Built once every file has settled.
 */
public record BatchRecord(
    UUID batchId,
    int totalFiles,
    int processedCount,
    int failedCount,
    int storedCount,
    double successRate,
    BatchStatus status,
    List<BatchFileOutcome> outcomes,
    OffsetDateTime startedAt,
    double durationSeconds
) {
    public BatchRecord {
        outcomes = List.copyOf(outcomes);
    }

    public static BatchRecord from(UUID batchId, List<BatchFileOutcome> outcomes, OffsetDateTime startedAt, double durationSeconds) {
        List<BatchFileOutcome> ordered = outcomes.stream()
            .sorted(Comparator.comparingInt(BatchFileOutcome::index))
            .toList();

        int total = ordered.size();
        int processed = (int) ordered.stream().filter(BatchFileOutcome::isProcessed).count();
        int stored = (int) ordered.stream().filter(BatchFileOutcome::isStored).count();
        int failed = total - processed;

        return new BatchRecord(
            batchId,
            total,
            processed,
            failed,
            stored,
            successRate(processed, total),
            statusOf(processed, failed),
            ordered,
            startedAt,
            durationSeconds
        );
    }

    private static double successRate(int processed, int total) {
        if (total == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(processed * 100.0 / total)
            .setScale(2, RoundingMode.HALF_UP)
            .doubleValue();
    }

    private static BatchStatus statusOf(int processed, int failed) {
        if (failed == 0) {
            return BatchStatus.COMPLETED;
        }
        return processed == 0 ? BatchStatus.FAILED : BatchStatus.PARTIAL_SUCCESS;
    }
}
