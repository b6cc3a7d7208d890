package com.clinicdocs.search.controller;

import com.clinicdocs.search.model.NameSuggestion;
import com.clinicdocs.search.model.SuggestionResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SuggestionResponse(
    @JsonProperty("partial_term") String partialTerm,
    @JsonProperty("normalized_term") String normalizedTerm,
    List<String> suggestions,
    List<NameSuggestion> details
) {
    public static SuggestionResponse from(SuggestionResult result) {
        return new SuggestionResponse(
            result.partialTerm(),
            result.normalizedTerm(),
            result.suggestions().stream().map(NameSuggestion::name).toList(),
            result.suggestions()
        );
    }
}
