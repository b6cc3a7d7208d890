package com.clinicdocs.search.model;

public record SimilarityMatch(
    double score,
    MatchType matchType
) {
    public SimilarityMatch {
        if (score < 0 || score > 1.000001) {
            throw new IllegalArgumentException("Invalid similarity score: " + score);
        }
    }
}
