package com.clinicdocs.search.model;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Clinic-area codes accepted as the last filename segment.
 */
@Getter
public enum MedicalCategory {
    EMER("Emergencias"),
    CONS("Consulta Externa"),
    LAB("Laboratorio"),
    RAD("Radiologia"),
    CIRC("Cirugia"),
    HOSP("Hospitalizacion"),
    UCI("Unidad de Cuidados Intensivos"),
    URG("Urgencias");

    private final String description;

    MedicalCategory(String description) {
        this.description = description;
    }

    public static Optional<MedicalCategory> fromCode(String code) {
        return Arrays.stream(values())
            .filter(category -> category.name().equals(code))
            .findFirst();
    }
}
