package com.libragraph.registry.core.authority;

import com.fasterxml.jackson.databind.JsonNode;
import com.libragraph.registry.types.AssetType;
import com.libragraph.registry.util.ContentHash;

import java.time.Instant;
import java.util.Objects;

/**
 * One immutable, registered version of an asset. (assetName, version) is unique
 * in the authority; contentHash is the digest of the canonical payload.
 */
public record AssetVersion(
        String assetName,
        AssetType assetType,
        String version,
        ContentHash contentHash,
        JsonNode payload,
        Instant createdAt
) {
    public AssetVersion {
        Objects.requireNonNull(assetName, "assetName cannot be null");
        Objects.requireNonNull(assetType, "assetType cannot be null");
        Objects.requireNonNull(version, "version cannot be null");
        Objects.requireNonNull(contentHash, "contentHash cannot be null");
        Objects.requireNonNull(payload, "payload cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
        payload = payload.deepCopy();
    }

    @Override
    public JsonNode payload() {
        return payload.deepCopy();
    }

    /** {@code name:version}, the form used in log lines and guidance. */
    public String label() {
        return assetName + ":" + version;
    }
}
