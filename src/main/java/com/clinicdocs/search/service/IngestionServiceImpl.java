package com.clinicdocs.search.service;

import com.clinicdocs.search.config.IngestionProperties;
import com.clinicdocs.search.exception.DocumentServiceException;
import com.clinicdocs.search.exception.OcrGatewayException;
import com.clinicdocs.search.exception.PersistenceException;
import com.clinicdocs.search.exception.StorageGatewayException;
import com.clinicdocs.search.exception.ValidationException;
import com.clinicdocs.search.gateway.OcrGateway;
import com.clinicdocs.search.gateway.OcrResult;
import com.clinicdocs.search.gateway.StorageGateway;
import com.clinicdocs.search.matching.FilenameMetadataExtractor;
import com.clinicdocs.search.matching.NameNormalizer;
import com.clinicdocs.search.model.BatchFileOutcome;
import com.clinicdocs.search.model.BatchRecord;
import com.clinicdocs.search.model.DocumentRecord;
import com.clinicdocs.search.model.FilenameMetadata;
import com.clinicdocs.search.model.InsertOutcome;
import com.clinicdocs.search.model.OcrSummary;
import com.clinicdocs.search.model.ProcessingStatus;
import com.clinicdocs.search.model.StorageLocation;
import com.clinicdocs.search.model.UploadFile;
import com.clinicdocs.search.repository.DocumentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

@Slf4j
@Service
public class IngestionServiceImpl implements IngestionService {

    private static final Map<String, String> CONTENT_TYPES = Map.of(
        "pdf", "application/pdf",
        "png", "image/png",
        "jpg", "image/jpeg",
        "jpeg", "image/jpeg",
        "gif", "image/gif",
        "bmp", "image/bmp",
        "tif", "image/tiff",
        "tiff", "image/tiff"
    );
    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final FilenameMetadataExtractor metadataExtractor;
    private final NameNormalizer nameNormalizer;
    private final StorageGateway storageGateway;
    private final OcrGateway ocrGateway;
    private final DocumentRepository documentRepository;
    private final AsyncTaskExecutor ingestionExecutor;
    private final IngestionProperties properties;
    private final Clock clock;

    public IngestionServiceImpl(
        FilenameMetadataExtractor metadataExtractor,
        NameNormalizer nameNormalizer,
        StorageGateway storageGateway,
        OcrGateway ocrGateway,
        DocumentRepository documentRepository,
        @Qualifier("ingestionTaskExecutor") AsyncTaskExecutor ingestionExecutor,
        IngestionProperties properties,
        Clock clock
    ) {
        this.metadataExtractor = metadataExtractor;
        this.nameNormalizer = nameNormalizer;
        this.storageGateway = storageGateway;
        this.ocrGateway = ocrGateway;
        this.documentRepository = documentRepository;
        this.ingestionExecutor = ingestionExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public DocumentRecord ingestDocument(UploadFile file, String ownerUserId) {
        validate(file);
        log.debug("Ingesting {} ({} bytes) for user {}", file.filename(), file.size(), ownerUserId);

        DocumentRecord record = process(file, ownerUserId, null, null, null);
        try {
            DocumentRecord saved = documentRepository.insertOne(record);
            log.info("Document {} persisted with status {}", saved.id(), saved.processingStatus());
            return saved;
        } catch (DataAccessException e) {
            log.error("Could not persist document {} ({})", record.id(), record.filename(), e);
            discardBlob(record.storage());
            throw new PersistenceException("Document " + record.filename() + " could not be saved", e);
        }
    }

    @Override
    public BatchRecord ingestBatch(List<UploadFile> files, String ownerUserId) {
        validateBatch(files);

        UUID batchId = UUID.randomUUID();
        OffsetDateTime startedAt = now();
        long started = System.nanoTime();
        log.info("Batch {} started with {} files for user {}", batchId, files.size(), ownerUserId);

        UploadedBlobs uploaded = new UploadedBlobs();
        List<Future<BatchFileOutcome>> futures = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            int index = i;
            UploadFile file = files.get(i);
            futures.add(ingestionExecutor.submit(() -> attempt(index, file, ownerUserId, batchId, uploaded)));
        }

        List<BatchFileOutcome> outcomes = awaitAll(batchId, futures, uploaded);

        List<DocumentRecord> stored = outcomes.stream()
            .filter(BatchFileOutcome::isStored)
            .map(BatchFileOutcome::document)
            .toList();
        if (!stored.isEmpty()) {
            persistBatch(batchId, stored);
        }

        BatchRecord batch = BatchRecord.from(batchId, outcomes, startedAt, elapsedSeconds(started));
        log.info("Batch {} finished with status {}: {} processed, {} failed, {} stored",
            batchId, batch.status(), batch.processedCount(), batch.failedCount(), batch.storedCount());
        return batch;
    }

    private BatchFileOutcome attempt(int index, UploadFile file, String ownerUserId, UUID batchId, UploadedBlobs uploaded) {
        String filename = file == null ? null : file.filename();
        try {
            validate(file);
            return BatchFileOutcome.stored(index, process(file, ownerUserId, batchId, index, uploaded));
        } catch (DocumentServiceException e) {
            log.warn("Batch {} file #{} ({}) failed: {}", batchId, index, filename, e.getMessage());
            return BatchFileOutcome.rejected(index, filename, e.getKind(), e.getMessage());
        }
    }

    private List<BatchFileOutcome> awaitAll(UUID batchId, List<Future<BatchFileOutcome>> futures, UploadedBlobs uploaded) {
        List<BatchFileOutcome> outcomes = new ArrayList<>(futures.size());
        try {
            for (Future<BatchFileOutcome> future : futures) {
                outcomes.add(future.get());
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelBatch(batchId, futures, uploaded);
            throw new CancellationException("Batch " + batchId + " was cancelled");
        } catch (ExecutionException e) {
            cancelBatch(batchId, futures, uploaded);
            if (e.getCause() instanceof CancellationException cancellation) {
                throw cancellation;
            }
            log.error("Batch {} aborted by an internal failure", batchId, e.getCause());
            throw new IllegalStateException("Batch " + batchId + " worker failed", e.getCause());
        }
    }

    private void cancelBatch(UUID batchId, List<Future<BatchFileOutcome>> futures, UploadedBlobs uploaded) {
        log.warn("Cancelling batch {}", batchId);
        futures.forEach(future -> future.cancel(true));
        uploaded.cancelAndDrain().forEach(this::discardBlob);
    }

    private void persistBatch(UUID batchId, List<DocumentRecord> records) {
        List<InsertOutcome> results;
        try {
            results = documentRepository.insertMany(records);
        } catch (DataAccessException e) {
            log.error("Bulk insert of batch {} failed, removing {} stored blobs", batchId, records.size(), e);
            records.forEach(record -> discardBlob(record.storage()));
            throw new PersistenceException("Batch " + batchId + " could not be saved", e);
        }

        Set<UUID> notInserted = results.stream()
            .filter(result -> !result.inserted())
            .map(InsertOutcome::documentId)
            .collect(Collectors.toSet());
        if (!notInserted.isEmpty()) {
            log.error("Batch {}: {} of {} documents were not inserted", batchId, notInserted.size(), records.size());
            records.stream()
                .filter(record -> notInserted.contains(record.id()))
                .forEach(record -> discardBlob(record.storage()));
            throw new PersistenceException("Batch " + batchId + " was only partially saved", null);
        }
        log.debug("Batch {}: persisted {} documents", batchId, records.size());
    }

    /**
     * Steps up to OCR. Returns a record in {@link ProcessingStatus#COMPLETED} or
     * {@link ProcessingStatus#FAILED}; any exception leaves no blob behind.
     */
    private DocumentRecord process(UploadFile file, String ownerUserId, UUID batchId, Integer batchIndex, UploadedBlobs uploaded) {
        OffsetDateTime now = now();
        DocumentRecord record = DocumentRecord.builder()
            .id(UUID.randomUUID())
            .processingId(UUID.randomUUID())
            .batchId(batchId)
            .batchIndex(batchIndex)
            .filename(file.filename())
            .contentType(contentTypeOf(file))
            .fileSize(file.size())
            .ownerUserId(ownerUserId)
            .description(file.description())
            .tags(file.tags())
            .processingStatus(ProcessingStatus.PENDING)
            .createdAt(now)
            .updatedAt(now)
            .build();

        record = withMetadata(record, metadataExtractor.extract(file.filename()));

        StorageLocation location = store(file, record);
        if (uploaded != null && !uploaded.track(location)) {
            releaseBlob(location, uploaded);
            throw new CancellationException("Ingestion of " + file.filename() + " was cancelled");
        }

        try {
            record = record.withStorage(location, now());
            ensureNotCancelled(record);
            record = withOcr(record);
            ensureNotCancelled(record);
            return record;
        } catch (RuntimeException e) {
            releaseBlob(location, uploaded);
            throw e;
        }
    }

    private StorageLocation store(UploadFile file, DocumentRecord record) {
        try {
            return storageGateway.put(file.content(), blobNameFor(record), record.contentType());
        } catch (StorageGatewayException | CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Storage gateway failed unexpectedly for {}", record.filename(), e);
            throw new StorageGatewayException("Storage of " + record.filename() + " failed: " + e.getMessage(), e);
        }
    }

    private DocumentRecord withMetadata(DocumentRecord record, FilenameMetadata metadata) {
        if (!metadata.valid()) {
            log.warn("Filename {} carries no usable medical metadata: {}", record.filename(), metadata.error());
            return record.toBuilder()
                .medicalInfoValid(false)
                .medicalInfoError(metadata.error())
                .build();
        }

        String normalized = nameNormalizer.normalize(metadata.nombrePaciente());
        if (normalized.isEmpty()) {
            log.warn("Filename {} has a patient name without searchable characters", record.filename());
            return record.toBuilder()
                .medicalInfoValid(false)
                .medicalInfoError("Patient name '" + metadata.nombrePaciente() + "' has no searchable characters")
                .build();
        }

        return record.toBuilder()
            .expediente(metadata.expediente())
            .nombrePaciente(metadata.nombrePaciente())
            .normalizedPatientName(normalized)
            .numeroEpisodio(metadata.numeroEpisodio())
            .categoria(metadata.categoria())
            .medicalInfoValid(true)
            .build();
    }

    private DocumentRecord withOcr(DocumentRecord record) {
        long started = System.nanoTime();
        try {
            OcrResult ocr = extractText(record);
            return record.toBuilder()
                .extractedText(ocr.text())
                .ocrSummary(new OcrSummary(ocr.pageCount(), ocr.processingTimeSeconds(), true))
                .build()
                .transitionTo(ProcessingStatus.OCR_COMPLETED, now())
                .transitionTo(ProcessingStatus.COMPLETED, now());
        } catch (OcrGatewayException e) {
            log.warn("OCR failed for document {} ({}): {}", record.id(), record.filename(), e.getMessage());
            return record.toBuilder()
                .ocrSummary(OcrSummary.failed(elapsedSeconds(started)))
                .errorMessage(e.getMessage())
                .build()
                .transitionTo(ProcessingStatus.FAILED, now());
        }
    }

    private OcrResult extractText(DocumentRecord record) {
        try {
            return ocrGateway.extractText(record.storage());
        } catch (OcrGatewayException | CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("OCR gateway failed unexpectedly for document {}", record.id(), e);
            throw new OcrGatewayException("Text extraction failed: " + e.getMessage(), e);
        }
    }

    private void ensureNotCancelled(DocumentRecord record) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Ingestion of " + record.filename() + " was cancelled");
        }
    }

    private void releaseBlob(StorageLocation location, UploadedBlobs uploaded) {
        if (uploaded == null || uploaded.release(location)) {
            discardBlob(location);
        }
    }

    private void discardBlob(StorageLocation location) {
        if (location == null) {
            return;
        }
        try {
            storageGateway.delete(location.blobName());
        } catch (StorageGatewayException e) {
            log.error("Could not remove blob {}; it is now orphaned", location.blobName(), e);
        }
    }

    private void validate(UploadFile file) {
        if (file == null) {
            throw new ValidationException("File is required");
        }
        if (file.filename() == null || file.filename().isBlank()) {
            throw new ValidationException("Filename is required");
        }
        if (file.size() == 0) {
            throw new ValidationException("File " + file.filename() + " is empty");
        }
        if (file.size() > properties.maxFileSizeBytes()) {
            throw new ValidationException(
                "File %s is %d bytes, above the limit of %d".formatted(file.filename(), file.size(), properties.maxFileSizeBytes()),
                "Compress or split the document");
        }
        String extension = extensionOf(file.filename());
        if (!properties.isAllowedExtension(extension)) {
            throw new ValidationException(
                "File type '%s' of %s is not allowed".formatted(extension, file.filename()),
                "Allowed types: " + String.join(", ", properties.allowedExtensions()));
        }
    }

    private void validateBatch(List<UploadFile> files) {
        if (files == null || files.isEmpty()) {
            throw new ValidationException("At least one file is required");
        }
        if (files.size() > properties.maxFilesPerBatch()) {
            throw new ValidationException(
                "Too many files: %d (maximum %d per batch)".formatted(files.size(), properties.maxFilesPerBatch()),
                "Split the upload into smaller batches");
        }
    }

    private static String contentTypeOf(UploadFile file) {
        if (file.contentType() != null && !file.contentType().isBlank()) {
            return file.contentType();
        }
        return CONTENT_TYPES.getOrDefault(extensionOf(file.filename()), DEFAULT_CONTENT_TYPE);
    }

    private static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static String blobNameFor(DocumentRecord record) {
        return record.id().toString().replace("-", "") + "_" + record.filename();
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    private static double elapsedSeconds(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000_000.0;
    }
}
