package com.clinicdocs.search.model;

import lombok.Builder;

import java.util.List;
import java.util.UUID;

/**
 * Conjunctive filter for repository queries. Null fields do not restrict.
 * {@code nameTokens} matches when any token occurs inside the normalized name;
 * {@code namePrefixOf} matches names the given term starts with.
 */
@Builder(toBuilder = true)
public record DocumentFilter(
    String ownerUserId,
    UUID batchId,
    String namePrefix,
    String nameContains,
    String namePrefixOf,
    List<String> nameTokens,
    Boolean hasPatientName,
    ProcessingStatus status
) {
    public DocumentFilter {
        nameTokens = nameTokens == null ? List.of() : List.copyOf(nameTokens);
    }

    public static DocumentFilter none() {
        return DocumentFilter.builder().build();
    }

    public static DocumentFilter namedDocuments(String ownerUserId) {
        return DocumentFilter.builder()
            .ownerUserId(ownerUserId)
            .hasPatientName(true)
            .build();
    }
}
