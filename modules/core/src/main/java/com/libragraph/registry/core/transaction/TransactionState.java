package com.libragraph.registry.core.transaction;

import com.libragraph.registry.types.AssetType;
import com.libragraph.registry.util.ContentHash;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Audit record of one asset validation. Immutable once returned from
 * {@link AssetTransaction#validateForUse}.
 *
 * @param requestedVersion the caller's version hint, may be null
 * @param resolvedVersion  version the asset resolved to, null when nothing resolved
 * @param contentHash      hash of the resolved version, null when nothing resolved
 */
public record TransactionState(
        String transactionId,
        String assetName,
        AssetType assetType,
        String requestedVersion,
        String resolvedVersion,
        ContentHash contentHash,
        ResultCode resultCode,
        boolean newVersionCreated,
        List<String> errors,
        Instant timestamp
) {
    public TransactionState {
        Objects.requireNonNull(transactionId, "transactionId cannot be null");
        Objects.requireNonNull(assetName, "assetName cannot be null");
        Objects.requireNonNull(assetType, "assetType cannot be null");
        Objects.requireNonNull(resultCode, "resultCode cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        errors = List.copyOf(errors);
    }

    public boolean isAcceptable() {
        return resultCode.isAcceptable();
    }

    static Draft draft(String transactionId, String assetName, AssetType assetType,
                       String requestedVersion, Instant timestamp) {
        return new Draft(transactionId, assetName, assetType, requestedVersion, timestamp);
    }

    /**
     * Mutable state while a validation is in flight.
     */
    static final class Draft {
        private final String transactionId;
        private final String assetName;
        private final AssetType assetType;
        private final String requestedVersion;
        private final Instant timestamp;
        private final List<String> errors = new ArrayList<>();
        private String resolvedVersion;
        private ContentHash contentHash;
        private ResultCode resultCode;
        private boolean newVersionCreated;

        private Draft(String transactionId, String assetName, AssetType assetType,
                      String requestedVersion, Instant timestamp) {
            this.transactionId = transactionId;
            this.assetName = assetName;
            this.assetType = assetType;
            this.requestedVersion = requestedVersion;
            this.timestamp = timestamp;
        }

        Draft resolved(String version, ContentHash hash) {
            this.resolvedVersion = version;
            this.contentHash = hash;
            return this;
        }

        Draft newVersionCreated() {
            this.newVersionCreated = true;
            return this;
        }

        Draft result(ResultCode code) {
            this.resultCode = code;
            return this;
        }

        Draft error(String message) {
            errors.add(message);
            return this;
        }

        TransactionState build() {
            if (resultCode == null) {
                throw new IllegalStateException("No result recorded for " + assetName);
            }
            return new TransactionState(transactionId, assetName, assetType, requestedVersion,
                    resolvedVersion, contentHash, resultCode, newVersionCreated, errors, timestamp);
        }
    }
}
