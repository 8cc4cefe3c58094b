package com.libragraph.registry.core.storage;

import com.libragraph.registry.util.ContentHash;

import java.nio.file.Path;

/**
 * A blob as found on disk, with both sidecars read back.
 */
public record StoredBlob(
        ContentHash contentHash,
        Path storagePath,
        BlobMetadata metadata,
        BlobProvenance provenance
) {}
