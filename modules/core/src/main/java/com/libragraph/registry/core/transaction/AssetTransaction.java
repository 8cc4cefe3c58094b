package com.libragraph.registry.core.transaction;

import com.fasterxml.jackson.databind.JsonNode;
import com.libragraph.registry.core.authority.AssetVersion;
import com.libragraph.registry.core.authority.AuthorityException;
import com.libragraph.registry.core.authority.VersionAuthority;
import com.libragraph.registry.core.resolve.AssetDocument;
import com.libragraph.registry.core.storage.ContentAddressableStore;
import com.libragraph.registry.core.storage.IntegrityException;
import com.libragraph.registry.core.storage.StorageException;
import com.libragraph.registry.core.storage.StoreResult;
import com.libragraph.registry.core.version.AllocatedVersion;
import com.libragraph.registry.types.AssetType;
import com.libragraph.registry.util.ContentHash;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One unit of work over a set of assets, created by {@link TransactionCoordinator#begin()}.
 *
 * <p>Each asset is validated independently and its registration commits on its own, so
 * partial success is normal; {@link #isTransactionValid()} gives the aggregate decision and
 * {@link #rollback()} removes the versions this transaction registered. Blobs are never
 * deleted. Not thread-safe: one caller per transaction.
 */
public class AssetTransaction {

    private static final Logger log = Logger.getLogger(AssetTransaction.class);

    public static final String DEFAULT_VERSION = "v1.0.0";
    static final String COMMIT_METHOD = "transaction_commit";
    static final String IMPORT_METHOD = "transaction_import";

    private final String id;
    private final Instant startTime;
    private final TransactionCoordinator coordinator;
    private final List<TransactionState> states = new ArrayList<>();
    private final List<RollbackOutcome> rollbackOutcomes = new ArrayList<>();
    private boolean rolledBack;
    private boolean verdictInspected;

    AssetTransaction(String id, Instant startTime, TransactionCoordinator coordinator) {
        this.id = id;
        this.startTime = startTime;
        this.coordinator = coordinator;
    }

    public String id() {
        return id;
    }

    public Instant startTime() {
        return startTime;
    }

    public List<TransactionState> states() {
        return List.copyOf(states);
    }

    public List<RollbackOutcome> rollbackOutcomes() {
        return List.copyOf(rollbackOutcomes);
    }

    public boolean isRolledBack() {
        return rolledBack;
    }

    public TransactionState validateForUse(String assetName, Path filePath, String versionHint) {
        return validateForUse(AssetType.FRAMEWORK, assetName, filePath, versionHint);
    }

    /**
     * Decides whether an asset can be used and records the decision.
     *
     * @param filePath    definition file or directory holding one; null or missing means no local file
     * @param versionHint requested version in any spelling; null for the latest
     * @throws IllegalStateException if this transaction was rolled back or its verdict was already inspected
     */
    public TransactionState validateForUse(AssetType type, String assetName, Path filePath, String versionHint) {
        if (rolledBack) {
            throw new IllegalStateException("Transaction " + id + " was rolled back");
        }
        if (verdictInspected) {
            throw new IllegalStateException("Transaction " + id + " verdict was already inspected");
        }
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(assetName, "assetName cannot be null");

        TransactionState.Draft draft = TransactionState.draft(
                id, assetName, type, versionHint, coordinator.clock().instant());
        try {
            evaluate(draft, type, assetName, filePath, versionHint);
        } catch (IOException | RuntimeException e) {
            log.errorf(e, "tx=%s asset=%s: validation failed", id, assetName);
            draft.result(ResultCode.VALIDATION_ERROR).error(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        TransactionState state = draft.build();
        states.add(state);
        logState(state);
        return state;
    }

    private void evaluate(TransactionState.Draft draft, AssetType type, String assetName,
                          Path filePath, String versionHint) throws IOException {
        VersionAuthority authority = coordinator.authority();
        Optional<AssetDocument> local = readLocal(type, filePath);
        Optional<AssetVersion> hit = authority.get(assetName, versionHint);

        if (hit.isPresent()) {
            AssetVersion current = hit.get();
            draft.resolved(current.version(), current.contentHash());
            if (local.isEmpty() || coordinator.changeDetector().isConsistent(local.get().payload(), current)) {
                draft.result(ResultCode.VALID);
                return;
            }
            AllocatedVersion next = coordinator.allocator().allocate(assetName, current.version(), id);
            log.infof("tx=%s asset=%s: content drifted from %s, promoting to %s (%s)",
                    id, assetName, current.version(), next.version(), next.strategy());
            commit(draft, type, assetName, next.version(), local.get(), COMMIT_METHOD, ResultCode.CONTENT_CHANGED);
            return;
        }

        if (local.isPresent()) {
            AssetDocument document = local.get();
            String version = versionHint != null && !versionHint.isBlank()
                    ? versionHint
                    : document.declaredVersion().orElse(DEFAULT_VERSION);
            if (authority.exists(assetName, version)) {
                version = coordinator.allocator().allocate(assetName, version, id).version();
            }
            commit(draft, type, assetName, version, document, IMPORT_METHOD, ResultCode.VALID);
            return;
        }

        draft.result(ResultCode.NOT_FOUND)
                .error("No authority record and no local file for " + type.label() + " " + assetName);
        if (versionHint != null && !versionHint.isBlank()) {
            authority.latest(assetName).ifPresent(latest -> draft.error(
                    "Version " + versionHint + " of " + assetName + " is not registered; latest is "
                            + latest.version()));
        }
    }

    private Optional<AssetDocument> readLocal(AssetType type, Path filePath) throws IOException {
        if (filePath == null) {
            return Optional.empty();
        }
        Optional<Path> file = coordinator.resolver().locate(type, filePath);
        if (file.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(coordinator.reader().read(file.get()));
    }

    /**
     * Stores the meaningful payload, checks an already-present blob, then registers the version.
     */
    private void commit(TransactionState.Draft draft, AssetType type, String assetName, String version,
                        AssetDocument document, String ingestionMethod, ResultCode success) {
        ContentAddressableStore store = coordinator.store();
        JsonNode payload = coordinator.changeDetector().meaningful(document.payload());
        try {
            StoreResult stored = store.store(payload, type, assetName, version,
                    document.sourcePath().toString(), ingestionMethod);
            if (stored.alreadyExisted() && store.loadVerified(stored.hash(), type).isEmpty()) {
                throw new StorageException("Blob directory has no payload: " + stored.path());
            }
            ContentHash hash = stored.hash();
            coordinator.authority().register(new AssetVersion(
                    assetName, type, version, hash, payload, coordinator.clock().instant()));
            draft.resolved(version, hash).newVersionCreated().result(success);
        } catch (IntegrityException e) {
            log.errorf(e, "tx=%s asset=%s:%s: stored blob is corrupt, operator attention required",
                    id, assetName, version);
            draft.result(ResultCode.TRANSACTION_FAILURE).error(e.getMessage());
        } catch (StorageException | AuthorityException e) {
            log.warnf(e, "tx=%s asset=%s:%s: commit failed", id, assetName, version);
            draft.result(ResultCode.TRANSACTION_FAILURE)
                    .error("Commit of " + assetName + ":" + version + " failed: " + e.getMessage());
        }
    }

    private void logState(TransactionState state) {
        String line = String.format("tx=%s asset=%s requested=%s resolved=%s hash=%s result=%s newVersion=%s errors=%s",
                state.transactionId(), state.assetName(), state.requestedVersion(), state.resolvedVersion(),
                state.contentHash() == null ? null : state.contentHash().shortHex(),
                state.resultCode(), state.newVersionCreated(), state.errors());
        if (state.isAcceptable()) {
            log.info(line);
        } else {
            log.warn(line);
        }
    }

    /**
     * Aggregate decision: valid iff every validated asset is VALID or CONTENT_CHANGED.
     * Closes the transaction to further validation; guidance and rollback stay available.
     */
    public TransactionVerdict isTransactionValid() {
        verdictInspected = true;
        List<String> messages = new ArrayList<>();
        int rejected = 0;
        for (TransactionState state : states) {
            if (state.isAcceptable()) {
                continue;
            }
            rejected++;
            messages.add(state.assetType().label() + " " + state.assetName() + ": " + state.resultCode());
            messages.addAll(state.errors());
        }
        if (rejected > 0) {
            log.errorf("Transaction %s rejected: %d of %d asset(s) invalid", id, rejected, states.size());
        } else {
            log.infof("Transaction %s valid: %d asset(s)", id, states.size());
        }
        return new TransactionVerdict(rejected == 0, messages);
    }

    public RollbackGuidance generateGuidance() {
        return GuidanceGenerator.generate(id, states, rollbackOutcomes);
    }

    /**
     * Deletes every version this transaction registered. Each deletion is attempted on its own;
     * failures are logged for manual intervention and reported in {@link #rollbackOutcomes()}.
     *
     * @return true if every deletion succeeded
     * @throws IllegalStateException if already rolled back
     */
    public boolean rollback() {
        if (rolledBack) {
            throw new IllegalStateException("Transaction " + id + " was already rolled back");
        }
        rolledBack = true;
        log.warnf("Rolling back transaction %s", id);

        boolean allRemoved = true;
        for (TransactionState state : states) {
            if (!state.newVersionCreated()) {
                continue;
            }
            RollbackOutcome outcome = remove(state.assetName(), state.resolvedVersion());
            rollbackOutcomes.add(outcome);
            if (outcome.succeeded()) {
                log.infof("tx=%s: removed %s", id, outcome.label());
            } else {
                allRemoved = false;
                log.errorf("tx=%s: MANUAL INTERVENTION REQUIRED, could not remove %s: %s",
                        id, outcome.label(), outcome.detail());
            }
        }
        log.infof("Transaction %s rollback %s", id, allRemoved ? "completed" : "incomplete");
        return allRemoved;
    }

    private RollbackOutcome remove(String assetName, String version) {
        try {
            return coordinator.authority().remove(assetName, version)
                    ? RollbackOutcome.removed(assetName, version)
                    : RollbackOutcome.failed(assetName, version, "record not found");
        } catch (RuntimeException e) {
            log.debugf(e, "tx=%s: delete of %s:%s threw", id, assetName, version);
            return RollbackOutcome.failed(assetName, version, e.getMessage());
        }
    }
}
