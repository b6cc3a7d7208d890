package com.clinicdocs.search.gateway;

import java.util.regex.Pattern;

public final class BlobNames {

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9._-]");

    private BlobNames() {
    }

    public static String sanitize(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Blob name cannot be blank");
        }
        String safe = UNSAFE.matcher(name.strip()).replaceAll("_");
        // no hidden files or parent references
        while (safe.startsWith(".")) {
            safe = "_" + safe.substring(1);
        }
        return safe;
    }
}
