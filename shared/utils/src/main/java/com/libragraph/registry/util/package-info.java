/**
 * Shared utilities for all registry modules.
 *
 * <p>Contains {@link com.libragraph.registry.util.ContentHash} (SHA-256) and
 * {@link com.libragraph.registry.util.CanonicalJson}, the canonicalization every
 * component hashes through. Depends only on Commons Codec and Jackson.
 */
package com.libragraph.registry.util;
