package com.clinicdocs.search.controller;

import com.clinicdocs.search.model.DocumentPage;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DocumentListResponse(
    List<DocumentResponse> documents,
    @JsonProperty("total_found") long totalFound,
    int limit,
    int skip,
    @JsonProperty("has_next") boolean hasNext
) {
    public static DocumentListResponse from(DocumentPage page, int limit, int skip) {
        return new DocumentListResponse(
            page.items().stream().map(DocumentResponse::from).toList(),
            page.totalFound(),
            limit,
            skip,
            (long) skip + limit < page.totalFound()
        );
    }
}
