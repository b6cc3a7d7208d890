package com.clinicdocs.search.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Matching strategies in fidelity order, highest first.
 */
public enum MatchType {
    EXACT,
    PREFIX,
    SUBSTRING,
    FUZZY,
    TEXT_SEARCH;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
