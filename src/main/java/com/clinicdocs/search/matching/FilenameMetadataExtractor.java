package com.clinicdocs.search.matching;

import com.clinicdocs.search.model.FilenameMetadata;
import com.clinicdocs.search.model.MedicalCategory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses {@code <expediente>_<nombre_paciente>_<numero_episodio>_<categoria>.<ext>}.
 * <p>
 * Never throws: every rejection is returned as an invalid {@link FilenameMetadata} with a reason.
 * Accepted segments are returned exactly as they appear in the filename.
 * <p>
 * With {@code app.metadata.strict-identifiers} enabled, the identifiers must additionally be
 * ten-digit numbers and the patient name must have the {@code LAST, FIRST} shape.
 */
@Component
public class FilenameMetadataExtractor {

    private static final int SEGMENT_COUNT = 4;
    private static final String[] SEGMENT_NAMES = {"expediente", "nombre_paciente", "numero_episodio", "categoria"};
    private static final Pattern TEN_DIGITS = Pattern.compile("\\d{10}");
    private static final Pattern ALL_ZEROS = Pattern.compile("0+");
    private static final Pattern NAME_PART = Pattern.compile("[\\p{L} ]+");

    private final boolean strictIdentifiers;

    public FilenameMetadataExtractor(@Value("${app.metadata.strict-identifiers:false}") boolean strictIdentifiers) {
        this.strictIdentifiers = strictIdentifiers;
    }

    public FilenameMetadata extract(String filename) {
        if (filename == null || filename.isBlank()) {
            return FilenameMetadata.invalid("Filename is empty");
        }

        String[] segments = stripExtension(filename).split("_", -1);
        if (segments.length < SEGMENT_COUNT) {
            return FilenameMetadata.invalid(
                "Expected %d segments separated by '_' (expediente_nombre_episodio_categoria) but found %d"
                    .formatted(SEGMENT_COUNT, segments.length));
        }
        if (segments.length > SEGMENT_COUNT) {
            return FilenameMetadata.invalid(
                "Too many segments: expected %d separated by '_' but found %d; the patient name cannot contain '_'"
                    .formatted(SEGMENT_COUNT, segments.length));
        }

        for (int i = 0; i < SEGMENT_COUNT; i++) {
            if (segments[i].isBlank()) {
                return FilenameMetadata.invalid("Segment '%s' is empty".formatted(SEGMENT_NAMES[i]));
            }
        }

        String categoria = segments[3];
        if (MedicalCategory.fromCode(categoria.trim()).isEmpty()) {
            return FilenameMetadata.invalid("Unknown category '%s'; expected one of %s"
                .formatted(categoria, validCodes()));
        }

        if (strictIdentifiers) {
            Optional<String> violation = strictViolation(segments);
            if (violation.isPresent()) {
                return FilenameMetadata.invalid(violation.get());
            }
        }

        return FilenameMetadata.valid(segments[0], segments[1], segments[2], categoria);
    }

    private Optional<String> strictViolation(String[] segments) {
        String expediente = segments[0].trim();
        if (!TEN_DIGITS.matcher(expediente).matches()) {
            return Optional.of("Expediente must be exactly 10 digits, got '%s'".formatted(expediente));
        }
        if (ALL_ZEROS.matcher(expediente).matches()) {
            return Optional.of("Expediente cannot be all zeros");
        }

        String episodio = segments[2].trim();
        if (!TEN_DIGITS.matcher(episodio).matches()) {
            return Optional.of("Numero de episodio must be exactly 10 digits, got '%s'".formatted(episodio));
        }
        if (ALL_ZEROS.matcher(episodio).matches()) {
            return Optional.of("Numero de episodio must be positive");
        }

        String[] nameParts = segments[1].split(",", -1);
        if (nameParts.length != 2) {
            return Optional.of("Patient name must have the form 'LAST NAMES, FIRST NAMES' with exactly one comma");
        }
        if (nameParts[0].isBlank() || nameParts[1].isBlank()) {
            return Optional.of("Patient name needs both last and first names around the comma");
        }
        if (!NAME_PART.matcher(nameParts[0].trim()).matches() || !NAME_PART.matcher(nameParts[1].trim()).matches()) {
            return Optional.of("Patient name may only contain letters and spaces");
        }
        return Optional.empty();
    }

    private static String stripExtension(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot > filename.lastIndexOf('_')) {
            return filename.substring(0, dot);
        }
        return filename;
    }

    private static String validCodes() {
        return Arrays.stream(MedicalCategory.values())
            .map(Enum::name)
            .collect(Collectors.joining(", "));
    }
}
