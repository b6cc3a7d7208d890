package com.clinicdocs.search.model;

import java.util.List;

public record UploadFile(
    byte[] content,
    String filename,
    String contentType,
    String description,
    List<String> tags
) {
    public UploadFile {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static UploadFile of(String filename, byte[] content) {
        return new UploadFile(content, filename, null, null, List.of());
    }

    public int size() {
        return content == null ? 0 : content.length;
    }
}
