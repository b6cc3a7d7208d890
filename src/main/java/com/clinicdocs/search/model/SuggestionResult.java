package com.clinicdocs.search.model;

import java.util.List;

public record SuggestionResult(
    String partialTerm,
    String normalizedTerm,
    List<NameSuggestion> suggestions
) {
    public SuggestionResult {
        suggestions = List.copyOf(suggestions);
    }
}
