package com.libragraph.registry.core.authority;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.registry.util.CanonicalJson;
import com.libragraph.registry.util.ContentHash;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.List;
import java.util.Set;

/**
 * Decides whether a candidate payload differs from a registered version.
 *
 * <p>Hashes cover only the meaningful part of a payload: top-level fields listed in
 * {@code registry.hash.ignored-fields} (export stamps, editor metadata) are dropped
 * before canonicalization.
 */
@ApplicationScoped
public class ChangeDetector {

    public static final String DEFAULT_IGNORED_FIELDS = "_metadata,_provenance,exported_at,last_modified";

    private final Set<String> ignoredFields;

    @Inject
    public ChangeDetector(
            @ConfigProperty(name = "registry.hash.ignored-fields",
                    defaultValue = DEFAULT_IGNORED_FIELDS) List<String> ignoredFields) {
        this.ignoredFields = Set.copyOf(ignoredFields);
    }

    public ChangeDetector() {
        this(List.of(DEFAULT_IGNORED_FIELDS.split(",")));
    }

    public Set<String> ignoredFields() {
        return ignoredFields;
    }

    /**
     * Copy of {@code payload} without incidental top-level fields.
     */
    public JsonNode meaningful(JsonNode payload) {
        JsonNode copy = payload.deepCopy();
        if (copy instanceof ObjectNode object) {
            object.remove(ignoredFields);
        }
        return copy;
    }

    public ContentHash hashOf(JsonNode payload) {
        return CanonicalJson.hash(meaningful(payload));
    }

    public ContentHash hashOf(AssetVersion version) {
        return hashOf(version.payload());
    }

    /**
     * Compares the file's hash with the hash the authority recorded for {@code version}.
     */
    public boolean isConsistent(JsonNode filePayload, AssetVersion version) {
        return hashOf(filePayload).equals(version.contentHash());
    }
}
