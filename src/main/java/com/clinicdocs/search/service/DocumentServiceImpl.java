package com.clinicdocs.search.service;

import com.clinicdocs.search.exception.DocumentAccessDeniedException;
import com.clinicdocs.search.exception.DocumentNotFoundException;
import com.clinicdocs.search.exception.StorageGatewayException;
import com.clinicdocs.search.exception.ValidationException;
import com.clinicdocs.search.gateway.StorageGateway;
import com.clinicdocs.search.model.DocumentFilter;
import com.clinicdocs.search.model.DocumentPage;
import com.clinicdocs.search.model.DocumentRecord;
import com.clinicdocs.search.model.DocumentStatistics;
import com.clinicdocs.search.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentServiceImpl implements DocumentService {

    private static final int MAX_PAGE_SIZE = 100;

    private final DocumentRepository documentRepository;
    private final StorageGateway storageGateway;

    @Override
    public DocumentRecord getDocument(UUID id, String requesterUserId) {
        log.debug("Fetching document {} for user {}", id, requesterUserId);

        DocumentRecord document = documentRepository.findById(id)
            .orElseThrow(() -> {
                log.warn("Document not found with ID: {}", id);
                return new DocumentNotFoundException(id);
            });

        if (requesterUserId != null && document.ownerUserId() != null
            && !document.ownerUserId().equals(requesterUserId)) {
            log.warn("User {} requested document {} owned by someone else", requesterUserId, id);
            throw new DocumentAccessDeniedException(id, requesterUserId);
        }
        return document;
    }

    @Override
    public DocumentPage listDocuments(DocumentFilter filter, int limit, int skip) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new ValidationException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (skip < 0) {
            throw new ValidationException("skip cannot be negative");
        }
        return documentRepository.findMany(filter == null ? DocumentFilter.none() : filter, limit, skip);
    }

    @Override
    public void deleteDocument(UUID id, String requesterUserId) {
        DocumentRecord document = getDocument(id, requesterUserId);

        if (!documentRepository.delete(id)) {
            throw new DocumentNotFoundException(id);
        }
        log.info("Deleted document {}", id);

        if (document.isStored()) {
            try {
                storageGateway.delete(document.storage().blobName());
            } catch (StorageGatewayException e) {
                log.warn("Document {} deleted but its blob {} could not be removed", id, document.storage().blobName(), e);
            }
        }
    }

    @Override
    public DocumentStatistics statistics(String ownerUserId) {
        return documentRepository.statistics(Optional.ofNullable(ownerUserId));
    }
}
