package com.clinicdocs.search.model;

import java.util.List;

public record DocumentPage(
    List<DocumentRecord> items,
    long totalFound
) {
    public DocumentPage {
        items = List.copyOf(items);
    }

    public static DocumentPage empty() {
        return new DocumentPage(List.of(), 0);
    }
}
