package com.clinicdocs.search.model;

/**
 * Outcome of parsing a document filename. Exactly one of the identifier group or
 * {@code error} is populated.
 */
public record FilenameMetadata(
    boolean valid,
    String expediente,
    String nombrePaciente,
    String numeroEpisodio,
    String categoria,
    String error
) {
    public FilenameMetadata {
        if (valid && error != null) {
            throw new IllegalArgumentException("Valid metadata cannot carry an error");
        }
        if (!valid && (error == null || error.isBlank())) {
            throw new IllegalArgumentException("Invalid metadata requires an error reason");
        }
    }

    public static FilenameMetadata valid(String expediente, String nombrePaciente, String numeroEpisodio, String categoria) {
        return new FilenameMetadata(true, expediente, nombrePaciente, numeroEpisodio, categoria, null);
    }

    public static FilenameMetadata invalid(String error) {
        return new FilenameMetadata(false, null, null, null, null, error);
    }
}
