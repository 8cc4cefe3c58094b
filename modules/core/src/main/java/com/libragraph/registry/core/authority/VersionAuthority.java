package com.libragraph.registry.core.authority;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of truth for which asset versions exist.
 *
 * <p>Owns a cache of resolved (name, versionHint) lookups. Any write or delete for an
 * asset evicts every cached entry for that asset name. Latest-version lookups are
 * never cached.
 *
 * <p>Each asset name carries a generation that every write bumps. A cached entry is
 * served only while its generation is current, so a lookup that raced a write
 * cannot leave a stale hit behind.
 */
@ApplicationScoped
public class VersionAuthority {

    private static final Logger log = Logger.getLogger(VersionAuthority.class);

    private final AuthorityGateway gateway;
    private final ConcurrentHashMap<CacheKey, Cached> cache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicLong> generations = new ConcurrentHashMap<>();

    private record CacheKey(String assetName, String versionHint) {}

    private record Cached(AssetVersion version, long generation) {}

    @Inject
    public VersionAuthority(AuthorityGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * Looks up an asset version. With a hint, tries the raw, v-prefixed and v-stripped
     * spellings in that order; without one, returns the most recently created version.
     */
    public Optional<AssetVersion> get(String assetName, String versionHint) {
        Objects.requireNonNull(assetName, "assetName cannot be null");
        if (versionHint == null || versionHint.isBlank()) {
            return gateway.findLatest(assetName);
        }
        CacheKey key = new CacheKey(assetName, versionHint);
        long generation = generationOf(assetName).get();
        Cached cached = cache.get(key);
        if (cached != null && cached.generation() == generation) {
            return Optional.of(cached.version());
        }
        Optional<AssetVersion> found = gateway.find(assetName, VersionSpelling.variants(versionHint));
        // stamped with the pre-lookup generation; a write during the lookup makes it unservable
        found.ifPresent(v -> cache.put(key, new Cached(v, generation)));
        return found;
    }

    public Optional<AssetVersion> latest(String assetName) {
        return get(assetName, null);
    }

    /**
     * True if {@code version}, in any accepted spelling, is registered for {@code assetName}.
     * Versions of other assets are irrelevant.
     */
    public boolean exists(String assetName, String version) {
        return get(assetName, version).isPresent();
    }

    public List<AssetVersion> versions(String assetName) {
        return gateway.listVersions(assetName);
    }

    /**
     * Registers a new version. Never retried here.
     *
     * @throws VersionAlreadyExistsException if the version is taken
     * @throws AuthorityException on any other write failure
     */
    public void register(AssetVersion version) {
        try {
            gateway.insert(version);
            log.infof("Registered %s type=%s hash=%s",
                    version.label(), version.assetType().label(), version.contentHash().shortHex());
        } finally {
            invalidate(version.assetName());
        }
    }

    /**
     * Deletes a version record.
     *
     * @return true if a record was removed
     */
    public boolean remove(String assetName, String version) {
        try {
            return gateway.delete(assetName, version);
        } finally {
            invalidate(assetName);
        }
    }

    public void invalidate(String assetName) {
        generationOf(assetName).incrementAndGet();
        cache.keySet().removeIf(k -> k.assetName().equals(assetName));
    }

    /**
     * Clears the cache (for testing).
     */
    public void clearCache() {
        generations.values().forEach(AtomicLong::incrementAndGet);
        cache.clear();
    }

    private AtomicLong generationOf(String assetName) {
        return generations.computeIfAbsent(assetName, n -> new AtomicLong());
    }
}
