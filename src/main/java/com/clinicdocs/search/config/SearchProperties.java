package com.clinicdocs.search.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.search")
public record SearchProperties(
    @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double defaultMinSimilarity,
    @NotNull @Min(1) @Max(100) Integer defaultLimit,
    @NotNull @Min(1) @Max(1000) Integer maxLimit,
    @NotNull @Min(1) Integer maxTermLength,
    @NotNull @Min(1) Integer candidateLimit,
    @NotNull @Min(0) Integer fallbackThreshold,
    @NotNull @Min(0) Integer fallbackLimit,
    @NotNull @Min(1) Integer minHintTokenLength,
    @NotNull @Min(1) Integer suggestionCandidateLimit,
    @NotNull @Min(1) Integer maxSuggestions,
    @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double patientDocumentsMinSimilarity,
    @NotNull @Valid Similarity similarity
) {

    public record Similarity(
        @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double fuzzyCharThreshold,
        @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double fuzzyTokenThreshold,
        @NotNull @Min(1) Integer minReversePrefixLength
    ) {}
}
