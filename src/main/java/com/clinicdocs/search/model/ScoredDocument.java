package com.clinicdocs.search.model;

import java.util.Comparator;

public record ScoredDocument(
    DocumentRecord document,
    double score,
    MatchType matchType
) {
    /**
     * Score descending, then shorter name, then lexical name, then id. Total over distinct documents.
     */
    public static final Comparator<ScoredDocument> RANKING = Comparator
        .comparingDouble(ScoredDocument::score).reversed()
        .thenComparingInt((ScoredDocument s) -> s.document().normalizedPatientName().length())
        .thenComparing((ScoredDocument s) -> s.document().normalizedPatientName())
        .thenComparing((ScoredDocument s) -> s.document().id());

    public static ScoredDocument of(DocumentRecord document, SimilarityMatch match) {
        return new ScoredDocument(document, match.score(), match.matchType());
    }
}
