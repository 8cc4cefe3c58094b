/**
 * Pure Java value types shared across all registry modules.
 *
 * <p>This module has no framework dependencies.
 */
package com.libragraph.registry.types;
