package com.clinicdocs.search.controller;

import com.clinicdocs.search.model.MatchType;
import com.clinicdocs.search.model.PatientSearchResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;

public record PatientSearchResponse(
    @JsonProperty("search_term") String searchTerm,
    @JsonProperty("normalized_term") String normalizedTerm,
    @JsonProperty("total_found") long totalFound,
    List<PatientMatchResponse> results,
    int limit,
    int skip,
    @JsonProperty("has_next") boolean hasNext,
    @JsonProperty("has_prev") boolean hasPrev,
    @JsonProperty("total_pages") int totalPages,
    @JsonProperty("strategies_used") List<MatchType> strategiesUsed,
    @JsonProperty("min_similarity") double minSimilarity,
    @JsonProperty("search_timestamp") OffsetDateTime searchTimestamp
) {
    public static PatientSearchResponse from(PatientSearchResult result) {
        return new PatientSearchResponse(
            result.searchTerm(),
            result.normalizedTerm(),
            result.totalFound(),
            result.items().stream().map(PatientMatchResponse::from).toList(),
            result.limit(),
            result.skip(),
            result.hasNext(),
            result.hasPrev(),
            result.totalPages(),
            result.strategiesUsed(),
            result.minSimilarity(),
            result.searchedAt()
        );
    }
}
