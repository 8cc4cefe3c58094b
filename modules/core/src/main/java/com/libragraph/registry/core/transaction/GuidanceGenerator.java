package com.libragraph.registry.core.transaction;

import com.libragraph.registry.types.AssetType;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns rejected transaction states and failed rollback deletions into guidance.
 */
public final class GuidanceGenerator {

    private GuidanceGenerator() {
    }

    public static RollbackGuidance generate(String transactionId, List<TransactionState> states,
                                            List<RollbackOutcome> rollbackOutcomes) {
        List<RollbackGuidance.FailedAsset> failed = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        List<String> nextSteps = new ArrayList<>();
        List<String> manual = new ArrayList<>();

        for (TransactionState state : states) {
            if (state.isAcceptable()) {
                continue;
            }
            failed.add(new RollbackGuidance.FailedAsset(state.assetName(), state.assetType(),
                    state.resultCode(), state.requestedVersion(), state.resolvedVersion(), state.errors()));
            advise(state, recommendations, nextSteps);
        }

        for (RollbackOutcome outcome : rollbackOutcomes) {
            if (!outcome.succeeded()) {
                manual.add("Remove authority record " + outcome.label()
                        + " by hand; rollback could not delete it (" + outcome.detail() + ")");
            }
        }

        return new RollbackGuidance(transactionId, states.size(), failed, recommendations, nextSteps, manual);
    }

    private static void advise(TransactionState state, List<String> recommendations, List<String> nextSteps) {
        String name = state.assetName();
        AssetType type = state.assetType();
        switch (state.resultCode()) {
            case NOT_FOUND -> {
                recommendations.add(type.label() + " '" + name + "' not found. "
                        + "Create its definition file and import it.");
                nextSteps.add("Create " + name + "/" + type.fileStem() + ".yaml in the asset workspace");
                nextSteps.add("Validate '" + name + "' again with the definition file path to import it");
                nextSteps.add("Confirm the imported version is listed for '" + name + "'");
            }
            case VERSION_MISMATCH -> {
                recommendations.add(type.label() + " '" + name + "' version mismatch. Expected: "
                        + state.requestedVersion() + ", Found: " + state.resolvedVersion());
                nextSteps.add("List the registered versions of '" + name + "'");
                nextSteps.add("Request version " + state.resolvedVersion() + " of '" + name
                        + "' or supply a definition file for " + state.requestedVersion());
            }
            case TRANSACTION_FAILURE -> {
                recommendations.add(type.label() + " '" + name + "' transaction failed. "
                        + "Check authority connectivity and blob storage integrity.");
                nextSteps.add("Check that the authority database is reachable");
                nextSteps.add("Verify the stored " + type.label() + " blobs of '" + name + "'");
                nextSteps.add("Retry the transaction for '" + name + "' once the cause is fixed");
            }
            case VALIDATION_ERROR -> {
                String cause = state.errors().isEmpty() ? "unknown error" : state.errors().get(0);
                recommendations.add(type.label() + " '" + name + "' could not be validated: " + cause);
                nextSteps.add("Check that the definition file of '" + name + "' parses as YAML or JSON");
                nextSteps.add("Validate '" + name + "' again");
            }
            default -> throw new IllegalArgumentException("No guidance for " + state.resultCode());
        }
    }
}
