package com.libragraph.registry.core.storage;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Contents of the {@code .metadata} sidecar next to a stored payload.
 */
public record BlobMetadata(
        @JsonProperty("asset_type") String assetType,
        @JsonProperty("asset_id") String assetId,
        @JsonProperty("version") String version,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("size") long size,
        @JsonProperty("content_hash") String contentHash
) {}
