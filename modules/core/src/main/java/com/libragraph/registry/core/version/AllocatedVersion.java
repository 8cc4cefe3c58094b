package com.libragraph.registry.core.version;

public record AllocatedVersion(String version, AllocationStrategy strategy) {}
