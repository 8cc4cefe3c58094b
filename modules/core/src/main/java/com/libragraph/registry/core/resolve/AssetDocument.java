package com.libragraph.registry.core.resolve;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.Optional;

/**
 * A parsed asset definition file.
 */
public record AssetDocument(Path sourcePath, JsonNode payload) {

    /**
     * Version the file declares for itself, from {@code version} or
     * {@code framework_meta.version}.
     */
    public Optional<String> declaredVersion() {
        Optional<String> top = text(payload.get("version"));
        if (top.isPresent()) {
            return top;
        }
        JsonNode meta = payload.get("framework_meta");
        return meta == null ? Optional.empty() : text(meta.get("version"));
    }

    private static Optional<String> text(JsonNode node) {
        if (node == null || !node.isValueNode() || node.isNull()) {
            return Optional.empty();
        }
        String value = node.asText().trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
}
