package com.libragraph.registry.core.transaction;

import com.libragraph.registry.types.AssetType;

import java.util.List;

/**
 * Actionable diagnostics for a transaction that did not fully succeed.
 *
 * @param manualInterventions rollback deletions that failed and must be cleaned up by hand
 */
public record RollbackGuidance(
        String transactionId,
        int totalAssets,
        List<FailedAsset> failedAssets,
        List<String> recommendations,
        List<String> nextSteps,
        List<String> manualInterventions
) {
    public RollbackGuidance {
        failedAssets = List.copyOf(failedAssets);
        recommendations = List.copyOf(recommendations);
        nextSteps = List.copyOf(nextSteps);
        manualInterventions = List.copyOf(manualInterventions);
    }

    public boolean hasFailures() {
        return !failedAssets.isEmpty() || !manualInterventions.isEmpty();
    }

    public record FailedAsset(
            String assetName,
            AssetType assetType,
            ResultCode resultCode,
            String requestedVersion,
            String resolvedVersion,
            List<String> errors
    ) {
        public FailedAsset {
            errors = List.copyOf(errors);
        }
    }
}
