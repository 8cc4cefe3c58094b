package com.libragraph.registry.core.authority;

import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Map-backed AuthorityGateway for tests and offline runs.
 *
 * <p>Failures can be injected per operation so callers' error paths can be
 * exercised without a real database.
 */
@ApplicationScoped
@IfBuildProperty(name = "registry.authority.type", stringValue = "memory")
public class InMemoryAuthorityGateway implements AuthorityGateway {

    // assetName -> (version -> record), insertion ordered
    private final Map<String, LinkedHashMap<String, AssetVersion>> versions = new LinkedHashMap<>();

    private RuntimeException lookupFailure;
    private RuntimeException insertFailure;
    private RuntimeException deleteFailure;

    @Override
    public synchronized Optional<AssetVersion> find(String assetName, List<String> candidates) {
        throwIfSet(lookupFailure);
        Map<String, AssetVersion> byVersion = versions.get(assetName);
        if (byVersion == null) {
            return Optional.empty();
        }
        for (String candidate : candidates) {
            AssetVersion hit = byVersion.get(candidate);
            if (hit != null) {
                return Optional.of(hit);
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized Optional<AssetVersion> findLatest(String assetName) {
        throwIfSet(lookupFailure);
        Map<String, AssetVersion> byVersion = versions.get(assetName);
        if (byVersion == null) {
            return Optional.empty();
        }
        AssetVersion latest = null;
        for (AssetVersion v : byVersion.values()) {
            if (latest == null || !v.createdAt().isBefore(latest.createdAt())) {
                latest = v;
            }
        }
        return Optional.ofNullable(latest);
    }

    @Override
    public synchronized List<AssetVersion> listVersions(String assetName) {
        throwIfSet(lookupFailure);
        Map<String, AssetVersion> byVersion = versions.get(assetName);
        return byVersion == null ? List.of() : List.copyOf(byVersion.values());
    }

    @Override
    public synchronized void insert(AssetVersion version) {
        throwIfSet(insertFailure);
        LinkedHashMap<String, AssetVersion> byVersion =
                versions.computeIfAbsent(version.assetName(), k -> new LinkedHashMap<>());
        if (byVersion.containsKey(version.version())) {
            throw new VersionAlreadyExistsException(version.assetName(), version.version());
        }
        byVersion.put(version.version(), version);
    }

    @Override
    public synchronized boolean delete(String assetName, String version) {
        throwIfSet(deleteFailure);
        Map<String, AssetVersion> byVersion = versions.get(assetName);
        if (byVersion == null || byVersion.remove(version) == null) {
            return false;
        }
        if (byVersion.isEmpty()) {
            versions.remove(assetName);
        }
        return true;
    }

    /** Every subsequent find/findLatest/listVersions throws {@code failure}; null clears. */
    public synchronized void failLookups(RuntimeException failure) {
        this.lookupFailure = failure;
    }

    /** Every subsequent insert throws {@code failure}; null clears. */
    public synchronized void failInserts(RuntimeException failure) {
        this.insertFailure = failure;
    }

    /** Every subsequent delete throws {@code failure}; null clears. */
    public synchronized void failDeletes(RuntimeException failure) {
        this.deleteFailure = failure;
    }

    /** Total number of registered versions across all assets. */
    public synchronized int size() {
        int total = 0;
        for (Map<String, AssetVersion> byVersion : versions.values()) {
            total += byVersion.size();
        }
        return total;
    }

    private static void throwIfSet(RuntimeException failure) {
        if (failure != null) {
            throw failure;
        }
    }
}
