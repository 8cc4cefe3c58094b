package com.libragraph.registry.core.version;

/**
 * Naming strategies in the order VersionAllocator tries them.
 */
public enum AllocationStrategy {
    PATCH_INCREMENT,
    DATE,
    DATE_HOUR,
    DATE_HOUR_MINUTE,
    DATE_HOUR_MINUTE_SECOND,
    MICROSECOND,
    TRANSACTION_SUFFIX
}
