package com.clinicdocs.search.repository;

import com.clinicdocs.search.model.DocumentFilter;
import com.clinicdocs.search.model.DocumentPage;
import com.clinicdocs.search.model.DocumentRecord;
import com.clinicdocs.search.model.DocumentStatistics;
import com.clinicdocs.search.model.InsertOutcome;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage of document records. Reads never alter business fields.
 * Failures surface as Spring {@link org.springframework.dao.DataAccessException}s.
 */
public interface DocumentRepository {
    DocumentRecord insertOne(DocumentRecord record);

    /**
     * Inserts all records atomically: either every record is stored or none is.
     */
    List<InsertOutcome> insertMany(List<DocumentRecord> records);

    Optional<DocumentRecord> findById(UUID id);

    /**
     * Newest first, ties broken by id.
     */
    DocumentPage findMany(DocumentFilter filter, int limit, int skip);

    boolean delete(UUID id);

    DocumentStatistics statistics(Optional<String> ownerUserId);
}
