package com.libragraph.registry.core.authority;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Version strings arrive spelled as {@code 1.0} or {@code v1.0}. Lookups try
 * raw, then v-prefixed, then v-stripped.
 */
public final class VersionSpelling {

    private VersionSpelling() {
    }

    public static List<String> variants(String version) {
        Objects.requireNonNull(version, "version cannot be null");
        String raw = version.trim();
        if (raw.isEmpty()) {
            throw new IllegalArgumentException("version cannot be blank");
        }
        Set<String> variants = new LinkedHashSet<>();
        variants.add(raw);
        variants.add(raw.startsWith("v") ? raw : "v" + raw);
        variants.add(raw.startsWith("v") ? raw.substring(1) : raw);
        variants.remove("");
        return new ArrayList<>(variants);
    }
}
