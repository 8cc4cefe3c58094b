package com.libragraph.registry.core.authority;

/**
 * Insert rejected because (assetName, version) is already registered.
 */
public class VersionAlreadyExistsException extends AuthorityException {

    private final String assetName;
    private final String version;

    public VersionAlreadyExistsException(String assetName, String version) {
        super("Version already exists: " + assetName + ":" + version);
        this.assetName = assetName;
        this.version = version;
    }

    public String assetName() {
        return assetName;
    }

    public String version() {
        return version;
    }
}
