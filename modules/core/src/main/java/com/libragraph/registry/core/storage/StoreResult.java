package com.libragraph.registry.core.storage;

import com.libragraph.registry.util.ContentHash;

import java.nio.file.Path;

/**
 * Outcome of {@link ContentAddressableStore#store}. {@code alreadyExisted=true} means
 * nothing was written by this call.
 */
public record StoreResult(ContentHash hash, Path path, boolean alreadyExisted) {}
