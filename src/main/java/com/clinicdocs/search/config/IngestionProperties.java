package com.clinicdocs.search.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Locale;

@Validated
@ConfigurationProperties(prefix = "app.ingestion")
public record IngestionProperties(
    @NotNull @Min(1) @Max(64) Integer maxWorkers,
    @NotNull @Min(1) Integer maxFilesPerBatch,
    @NotNull @Min(1) Long maxFileSizeBytes,
    @NotEmpty List<String> allowedExtensions
) {
    public boolean isAllowedExtension(String extension) {
        return extension != null && allowedExtensions.contains(extension.toLowerCase(Locale.ROOT));
    }
}
