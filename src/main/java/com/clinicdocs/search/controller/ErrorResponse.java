package com.clinicdocs.search.controller;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String message,
    String errorCode,
    String suggestion,
    int status,
    long timestamp
) {}
