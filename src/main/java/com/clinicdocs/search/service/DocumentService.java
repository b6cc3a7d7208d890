package com.clinicdocs.search.service;

import com.clinicdocs.search.model.DocumentFilter;
import com.clinicdocs.search.model.DocumentPage;
import com.clinicdocs.search.model.DocumentRecord;
import com.clinicdocs.search.model.DocumentStatistics;

import java.util.UUID;

public interface DocumentService {

    DocumentRecord getDocument(UUID id, String requesterUserId);
    DocumentPage listDocuments(DocumentFilter filter, int limit, int skip);
    void deleteDocument(UUID id, String requesterUserId);
    DocumentStatistics statistics(String ownerUserId);
}
