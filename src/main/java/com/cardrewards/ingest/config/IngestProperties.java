package com.cardrewards.ingest.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Immutable ingest configuration bound from the {@code ingest.*} namespace.
 * Passed explicitly into the poller and file processor so tests can point
 * them at temporary directories.
 */
@Validated
@ConfigurationProperties(prefix = "ingest")
public record IngestProperties(

    @NotNull Path incomingDir,

    @NotNull Path processedDir,

    @NotNull Path failedDir,

    @NotNull Path logFile,

    @Positive long pollIntervalMs,

    @NotBlank String ownerId,

    @NotNull @Valid Normalizer normalizer
) {

    /**
     * Connection settings for the text-generation endpoint.
     */
    public record Normalizer(

        @NotBlank String baseUrl,

        @NotBlank String chatEndpoint,

        @NotBlank String model,

        @Positive int connectTimeoutMs,

        @Positive int requestTimeoutMs
    ) {}
}
