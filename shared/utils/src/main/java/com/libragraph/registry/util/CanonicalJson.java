package com.libragraph.registry.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.util.Objects;

/**
 * Canonical form for structured content: object keys sorted recursively,
 * compact separators, UTF-8. Array order is preserved.
 *
 * <p>Two documents that differ only in key insertion order canonicalize to
 * identical bytes and therefore to the same {@link ContentHash}.
 */
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(JsonNodeFeature.WRITE_PROPERTIES_SORTED)
            .build();

    private CanonicalJson() {
    }

    /**
     * Serializes the canonical form to UTF-8 bytes.
     */
    public static byte[] toBytes(JsonNode node) {
        Objects.requireNonNull(node, "node cannot be null");
        try {
            return MAPPER.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize content to canonical JSON", e);
        }
    }

    /**
     * Parses bytes previously produced by {@link #toBytes(JsonNode)}.
     */
    public static JsonNode parse(byte[] bytes) {
        try {
            return MAPPER.readTree(bytes);
        } catch (IOException e) {
            throw new IllegalArgumentException("Content is not valid JSON", e);
        }
    }

    /**
     * SHA-256 over the canonical bytes.
     */
    public static ContentHash hash(JsonNode node) {
        return ContentHash.of(toBytes(node));
    }
}
