package com.clinicdocs.search.model;

public record PatientSearchQuery(
    String searchTerm,
    String ownerUserId,
    Double minSimilarity,
    Integer limit,
    Integer skip
) {}
