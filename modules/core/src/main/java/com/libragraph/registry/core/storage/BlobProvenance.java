package com.libragraph.registry.core.storage;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Contents of the {@code .provenance} sidecar: where a payload came from and how it got here.
 */
public record BlobProvenance(
        @JsonProperty("source_path") String sourcePath,
        @JsonProperty("ingestion_method") String ingestionMethod,
        @JsonProperty("timestamp") Instant timestamp
) {}
