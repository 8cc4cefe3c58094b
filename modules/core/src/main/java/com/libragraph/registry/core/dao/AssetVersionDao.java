package com.libragraph.registry.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(AssetVersionRecord.class)
public interface AssetVersionDao {

    @SqlQuery("SELECT * FROM asset_version WHERE asset_name = :name AND version IN (<versions>)")
    List<AssetVersionRecord> findByVersions(@Bind("name") String name,
                                            @BindList("versions") List<String> versions);

    @SqlQuery("SELECT * FROM asset_version WHERE asset_name = :name " +
            "ORDER BY created_at DESC, id DESC LIMIT 1")
    Optional<AssetVersionRecord> findLatest(@Bind("name") String name);

    @SqlQuery("SELECT * FROM asset_version WHERE asset_name = :name ORDER BY created_at, id")
    List<AssetVersionRecord> findAll(@Bind("name") String name);

    /**
     * Plain insert; the (asset_name, version) unique constraint rejects duplicates.
     */
    @SqlUpdate("INSERT INTO asset_version (asset_name, asset_type, version, content_hash, payload, created_at) " +
            "VALUES (:name, :type, :version, :hash, :payload, :createdAt)")
    int insert(@Bind("name") String name,
               @Bind("type") String type,
               @Bind("version") String version,
               @Bind("hash") String contentHash,
               @Bind("payload") String payload,
               @Bind("createdAt") Instant createdAt);

    @SqlUpdate("DELETE FROM asset_version WHERE asset_name = :name AND version = :version")
    int delete(@Bind("name") String name, @Bind("version") String version);
}
