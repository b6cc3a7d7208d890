package com.clinicdocs.search.model;

import java.util.UUID;

public record InsertOutcome(
    UUID documentId,
    boolean inserted
) {}
