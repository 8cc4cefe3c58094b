package com.libragraph.registry.core.transaction;

/**
 * Outcome of validating one asset inside a transaction.
 */
public enum ResultCode {
    VALID,
    /** Local content drifted from the registered version; a new version was minted. */
    CONTENT_CHANGED,
    NOT_FOUND,
    /** The requested version is unknown but other versions of the asset exist. */
    VERSION_MISMATCH,
    /** Storing or registering a new version failed. */
    TRANSACTION_FAILURE,
    VALIDATION_ERROR;

    /** True for the codes that let a transaction proceed. */
    public boolean isAcceptable() {
        return this == VALID || this == CONTENT_CHANGED;
    }
}
