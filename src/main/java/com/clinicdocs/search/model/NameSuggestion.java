package com.clinicdocs.search.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record NameSuggestion(
    String name,
    double score,
    @JsonProperty("match_type") MatchType matchType,
    @JsonProperty("document_count") long documentCount
) {}
