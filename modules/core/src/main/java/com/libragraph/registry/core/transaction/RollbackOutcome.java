package com.libragraph.registry.core.transaction;

/**
 * Result of deleting one authority record during rollback.
 *
 * @param detail failure reason, null when the deletion succeeded
 */
public record RollbackOutcome(String assetName, String version, boolean succeeded, String detail) {

    static RollbackOutcome removed(String assetName, String version) {
        return new RollbackOutcome(assetName, version, true, null);
    }

    static RollbackOutcome failed(String assetName, String version, String detail) {
        return new RollbackOutcome(assetName, version, false, detail);
    }

    public String label() {
        return assetName + ":" + version;
    }
}
