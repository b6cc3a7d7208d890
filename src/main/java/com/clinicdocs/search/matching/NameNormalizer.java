package com.clinicdocs.search.matching;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical comparison key for patient names, shared by ingestion and search.
 * <p>
 * Uppercases, strips diacritics, drops apostrophes, turns other punctuation into spaces,
 * keeps at most one comma rendered as {@code "LEFT, RIGHT"} and collapses whitespace.
 * Word order is preserved as written. The result is idempotent.
 */
@Component
public class NameNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern APOSTROPHES = Pattern.compile("['‘’ʼ`´]");
    private static final Pattern DISALLOWED = Pattern.compile("[^\\p{L}\\p{N}\\s,]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TOKEN_SEPARATORS = Pattern.compile("[\\s,]+");

    public String normalize(String raw) {
        if (raw == null) {
            return "";
        }

        String value = raw.toUpperCase(Locale.ROOT);
        value = Normalizer.normalize(value, Normalizer.Form.NFD);
        value = COMBINING_MARKS.matcher(value).replaceAll("");
        value = APOSTROPHES.matcher(value).replaceAll("");
        value = DISALLOWED.matcher(value).replaceAll(" ");

        int comma = value.indexOf(',');
        if (comma < 0) {
            return collapse(value);
        }

        String left = collapse(value.substring(0, comma));
        String right = collapse(value.substring(comma + 1).replace(',', ' '));
        if (left.isEmpty()) {
            return right;
        }
        if (right.isEmpty()) {
            return left;
        }
        return left + ", " + right;
    }

    /**
     * Whole-word tokens of an already normalized name.
     */
    public List<String> tokens(String normalized) {
        if (normalized == null || normalized.isBlank()) {
            return List.of();
        }
        return Arrays.stream(TOKEN_SEPARATORS.split(normalized.trim()))
            .filter(token -> !token.isEmpty())
            .toList();
    }

    private static String collapse(String value) {
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }
}
