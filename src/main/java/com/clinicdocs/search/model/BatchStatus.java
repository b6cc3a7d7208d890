package com.clinicdocs.search.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BatchStatus {
    COMPLETED,
    PARTIAL_SUCCESS,
    FAILED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
