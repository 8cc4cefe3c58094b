package com.libragraph.registry.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record AssetVersionRecord(
        @ColumnName("id") long id,
        @ColumnName("asset_name") String assetName,
        @ColumnName("asset_type") String assetType,
        @ColumnName("version") String version,
        @ColumnName("content_hash") String contentHash,
        @ColumnName("payload") String payload,
        @ColumnName("created_at") Instant createdAt
) {}
