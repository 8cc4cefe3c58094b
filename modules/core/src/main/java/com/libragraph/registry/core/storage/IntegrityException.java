package com.libragraph.registry.core.storage;

import com.libragraph.registry.types.AssetType;
import com.libragraph.registry.util.ContentHash;

/**
 * Thrown when a stored blob no longer hashes to the key it is filed under.
 * Never repaired automatically: the blob needs operator attention.
 */
public class IntegrityException extends RuntimeException {

    private final ContentHash expected;
    private final ContentHash actual;

    public IntegrityException(AssetType type, ContentHash expected, ContentHash actual) {
        super("Integrity violation: " + type.label() + " blob " + expected
                + " now hashes to " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public ContentHash expected() {
        return expected;
    }

    public ContentHash actual() {
        return actual;
    }
}
