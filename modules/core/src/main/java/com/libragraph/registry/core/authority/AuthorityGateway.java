package com.libragraph.registry.core.authority;

import java.util.List;
import java.util.Optional;

/**
 * Synchronous access to the authoritative store of asset versions.
 *
 * <p>Implementations are selected at build time via {@code registry.authority.type}:
 * {@code jdbc} (default) or {@code memory}. Timeouts and connection retries belong to
 * the underlying driver; callers of this interface never retry writes.
 */
public interface AuthorityGateway {

    /**
     * Finds the first of {@code versions} registered for {@code assetName},
     * honouring the order of the list.
     */
    Optional<AssetVersion> find(String assetName, List<String> versions);

    /**
     * Most recently created version of {@code assetName}.
     */
    Optional<AssetVersion> findLatest(String assetName);

    /**
     * All versions of {@code assetName}, oldest first.
     */
    List<AssetVersion> listVersions(String assetName);

    /**
     * Inserts a version unless (assetName, version) is already taken.
     *
     * @throws VersionAlreadyExistsException on a uniqueness violation
     * @throws AuthorityException on any other failure
     */
    void insert(AssetVersion version);

    /**
     * Deletes a version record.
     *
     * @return true if a record was removed, false if none matched
     * @throws AuthorityException if the store could not be reached
     */
    boolean delete(String assetName, String version);
}
