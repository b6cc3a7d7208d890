package com.clinicdocs.search.controller;

import com.clinicdocs.search.model.BatchRecord;
import com.clinicdocs.search.model.DocumentFilter;
import com.clinicdocs.search.model.DocumentRecord;
import com.clinicdocs.search.model.UploadFile;
import com.clinicdocs.search.service.DocumentService;
import com.clinicdocs.search.service.IngestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final IngestionService ingestionService;
    private final DocumentService documentService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DocumentResponse> uploadDocument(
        @RequestParam("file") MultipartFile file,
        @RequestParam(name = "user_id", required = false) String userId,
        @RequestParam(name = "description", required = false) String description,
        @RequestParam(name = "tags", required = false) List<String> tags) throws IOException {

        DocumentRecord document = ingestionService.ingestDocument(toUpload(file, description, tags), userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.from(document));
    }

    @PostMapping(path = "/batch", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<BatchUploadResponse> uploadBatch(
        @RequestParam("files") List<MultipartFile> files,
        @RequestParam(name = "user_id", required = false) String userId,
        @RequestParam(name = "description", required = false) String description,
        @RequestParam(name = "tags", required = false) List<String> tags) throws IOException {

        List<UploadFile> uploads = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            uploads.add(toUpload(file, description, tags));
        }
        BatchRecord batch = ingestionService.ingestBatch(uploads, userId);
        return ResponseEntity.ok(BatchUploadResponse.from(batch));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DocumentResponse> getDocument(
        @PathVariable UUID id,
        @RequestParam(name = "user_id", required = false) String userId) {
        return ResponseEntity.ok(DocumentResponse.from(documentService.getDocument(id, userId)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteDocument(
        @PathVariable UUID id,
        @RequestParam(name = "user_id", required = false) String userId) {
        documentService.deleteDocument(id, userId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping
    public ResponseEntity<DocumentListResponse> listDocuments(
        @RequestParam(name = "user_id", required = false) String userId,
        @RequestParam(name = "batch_id", required = false) UUID batchId,
        @RequestParam(name = "limit", defaultValue = "20") int limit,
        @RequestParam(name = "skip", defaultValue = "0") int skip) {

        DocumentFilter filter = DocumentFilter.builder()
            .ownerUserId(userId)
            .batchId(batchId)
            .build();
        return ResponseEntity.ok(DocumentListResponse.from(documentService.listDocuments(filter, limit, skip), limit, skip));
    }

    @GetMapping("/statistics")
    public ResponseEntity<StatisticsResponse> statistics(
        @RequestParam(name = "user_id", required = false) String userId) {
        return ResponseEntity.ok(StatisticsResponse.from(documentService.statistics(userId)));
    }

    private static UploadFile toUpload(MultipartFile file, String description, List<String> tags) throws IOException {
        return new UploadFile(file.getBytes(), file.getOriginalFilename(), file.getContentType(), description, tags);
    }
}
