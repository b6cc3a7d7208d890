package com.clinicdocs.search.model;

import java.time.OffsetDateTime;
import java.util.List;

public record PatientSearchResult(
    String searchTerm,
    String normalizedTerm,
    long totalFound,
    List<ScoredDocument> items,
    int limit,
    int skip,
    boolean hasNext,
    boolean hasPrev,
    int totalPages,
    List<MatchType> strategiesUsed,
    double minSimilarity,
    OffsetDateTime searchedAt
) {
    public PatientSearchResult {
        items = List.copyOf(items);
        strategiesUsed = List.copyOf(strategiesUsed);
    }
}
