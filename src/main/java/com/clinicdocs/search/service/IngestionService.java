package com.clinicdocs.search.service;

import com.clinicdocs.search.model.BatchRecord;
import com.clinicdocs.search.model.DocumentRecord;
import com.clinicdocs.search.model.UploadFile;

import java.util.List;

public interface IngestionService {

    /**
     * Runs the full pipeline for one file. A document whose OCR failed is still stored and
     * returned with status {@code failed}; storage, validation and persistence failures are thrown.
     */
    DocumentRecord ingestDocument(UploadFile file, String ownerUserId);

    /**
     * Processes files concurrently on the bounded ingestion pool. Per-file failures are reported
     * in the returned batch; only validation and persistence failures are thrown.
     */
    BatchRecord ingestBatch(List<UploadFile> files, String ownerUserId);
}
